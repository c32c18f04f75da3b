package com.libragraph.vpk.formats.codecs;

import com.libragraph.vpk.formats.api.Codec;
import com.libragraph.vpk.formats.api.CompressionException;
import com.libragraph.vpk.types.CompressionMode;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.lz4.FramedLZ4CompressorInputStream;
import org.apache.commons.compress.compressors.lz4.FramedLZ4CompressorOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Codec for LZ4 compression using the LZ4 frame format
 * (magic {@code 04 22 4D 18}), not the raw block format.
 */
@ApplicationScoped
public class Lz4Codec implements Codec {

    @Override
    public CompressionMode mode() {
        return CompressionMode.LZ4;
    }

    @Override
    public byte[] decode(byte[] input) {
        try {
            ByteArrayOutputStream output = new ByteArrayOutputStream(Math.max(input.length * 3, 4096));
            try (FramedLZ4CompressorInputStream lz4 = new FramedLZ4CompressorInputStream(new ByteArrayInputStream(input))) {
                lz4.transferTo(output);
            }
            return output.toByteArray();
        } catch (IOException e) {
            throw new CompressionException("Failed to decompress LZ4", e);
        }
    }

    @Override
    public byte[] encode(byte[] input) {
        try {
            ByteArrayOutputStream output = new ByteArrayOutputStream(Math.max(input.length / 2, 4096));
            try (FramedLZ4CompressorOutputStream lz4 = new FramedLZ4CompressorOutputStream(output)) {
                lz4.write(input);
            }
            return output.toByteArray();
        } catch (IOException e) {
            throw new CompressionException("Failed to compress with LZ4", e);
        }
    }
}
