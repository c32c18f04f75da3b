package com.libragraph.vpk.formats.codecs;

import com.libragraph.vpk.formats.api.Codec;
import com.libragraph.vpk.formats.api.CompressionException;
import com.libragraph.vpk.types.CompressionMode;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Codec for BZIP2 compression.
 * Uses Apache Commons Compress for BZIP2 support.
 */
@ApplicationScoped
public class Bzip2Codec implements Codec {

    /** Largest block size (900k), same default as the {@code bzip2} tool. */
    private static final int BLOCK_SIZE = 9;

    @Override
    public CompressionMode mode() {
        return CompressionMode.BZIP2;
    }

    @Override
    public byte[] decode(byte[] input) {
        try {
            ByteArrayOutputStream output = new ByteArrayOutputStream(Math.max(input.length * 3, 4096));
            try (BZip2CompressorInputStream bzip2 = new BZip2CompressorInputStream(new ByteArrayInputStream(input))) {
                bzip2.transferTo(output);
            }
            return output.toByteArray();
        } catch (IOException e) {
            throw new CompressionException("Failed to decompress BZIP2", e);
        }
    }

    @Override
    public byte[] encode(byte[] input) {
        try {
            ByteArrayOutputStream output = new ByteArrayOutputStream(Math.max(input.length / 3, 4096));
            try (BZip2CompressorOutputStream bzip2 = new BZip2CompressorOutputStream(output, BLOCK_SIZE)) {
                bzip2.write(input);
            }
            return output.toByteArray();
        } catch (IOException e) {
            throw new CompressionException("Failed to compress with BZIP2", e);
        }
    }
}
