package com.libragraph.vpk.formats.codecs;

import com.github.luben.zstd.Zstd;
import com.libragraph.vpk.formats.api.Codec;
import com.libragraph.vpk.formats.api.CompressionException;
import com.libragraph.vpk.types.CompressionMode;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Codec for Zstandard compression.
 *
 * <p>Encoding goes through the one-shot zstd-jni API so every frame, including the
 * one for an empty input, is complete and carries its content size. Decoding uses
 * the streaming reader from Commons Compress, which also accepts frames written
 * without a content size by other tools.
 */
@ApplicationScoped
public class ZstdCodec implements Codec {

    private static final int LEVEL = 3;

    @Override
    public CompressionMode mode() {
        return CompressionMode.ZSTD;
    }

    @Override
    public byte[] decode(byte[] input) {
        if (input.length == 0) {
            throw new CompressionException("Failed to decompress ZSTD: empty input");
        }
        try (ZstdCompressorInputStream zstd = new ZstdCompressorInputStream(new ByteArrayInputStream(input))) {
            return zstd.readAllBytes();
        } catch (IOException | RuntimeException e) {
            throw new CompressionException("Failed to decompress ZSTD", e);
        }
    }

    @Override
    public byte[] encode(byte[] input) {
        try {
            return Zstd.compress(input, LEVEL);
        } catch (RuntimeException e) {
            throw new CompressionException("Failed to compress with ZSTD", e);
        }
    }
}
