package com.libragraph.vpk.formats.codecs;

import com.libragraph.vpk.formats.api.Codec;
import com.libragraph.vpk.types.CompressionMode;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Arrays;

/**
 * No-op codec. Returns a copy of its input in both directions.
 */
@ApplicationScoped
public class PassthroughCodec implements Codec {

    @Override
    public CompressionMode mode() {
        return CompressionMode.NONE;
    }

    @Override
    public byte[] decode(byte[] input) {
        return Arrays.copyOf(input, input.length);
    }

    @Override
    public byte[] encode(byte[] input) {
        return Arrays.copyOf(input, input.length);
    }
}
