package com.libragraph.vpk.formats.codecs;

import com.libragraph.vpk.formats.api.Codec;
import com.libragraph.vpk.formats.api.CompressionException;
import com.libragraph.vpk.types.CompressionMode;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Codec for LZMA compression, framed as an {@code .xz} stream with CRC64 check.
 */
@ApplicationScoped
public class LzmaCodec implements Codec {

    @Override
    public CompressionMode mode() {
        return CompressionMode.LZMA;
    }

    @Override
    public byte[] decode(byte[] input) {
        try (XZCompressorInputStream xz = new XZCompressorInputStream(new ByteArrayInputStream(input))) {
            return xz.readAllBytes();
        } catch (IOException e) {
            throw new CompressionException("Failed to decompress LZMA", e);
        }
    }

    @Override
    public byte[] encode(byte[] input) {
        ByteArrayOutputStream output = new ByteArrayOutputStream(Math.max(input.length / 3, 4096));
        try (XZCompressorOutputStream xz = new XZCompressorOutputStream(output)) {
            xz.write(input);
        } catch (IOException e) {
            throw new CompressionException("Failed to compress with LZMA", e);
        }
        return output.toByteArray();
    }
}
