package com.libragraph.vpk.formats.codecs;

import com.libragraph.vpk.formats.api.Codec;
import com.libragraph.vpk.formats.api.CompressionException;
import com.libragraph.vpk.types.CompressionMode;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Codec for GZIP compression.
 * Writes a single gzip member; uses only {@code java.util.zip}.
 */
@ApplicationScoped
public class GzipCodec implements Codec {

    @Override
    public CompressionMode mode() {
        return CompressionMode.GZIP;
    }

    @Override
    public byte[] decode(byte[] input) {
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(input))) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            throw new CompressionException("Failed to decompress GZIP", e);
        }
    }

    @Override
    public byte[] encode(byte[] input) {
        ByteArrayOutputStream output = new ByteArrayOutputStream(Math.max(input.length / 3, 64));
        try (GZIPOutputStream gzip = new GZIPOutputStream(output)) {
            gzip.write(input);
        } catch (IOException e) {
            throw new CompressionException("Failed to compress with GZIP", e);
        }
        return output.toByteArray();
    }
}
