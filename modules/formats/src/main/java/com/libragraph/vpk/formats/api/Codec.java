package com.libragraph.vpk.formats.api;

import com.libragraph.vpk.types.CompressionMode;

/**
 * A compression codec working on whole in-memory buffers.
 *
 * <p>Every implementation must round-trip exactly, including for the empty array:
 * {@code decode(encode(x))} equals {@code x}. Codecs know nothing about
 * encryption or archive headers.
 */
public interface Codec {

    /** The mode this codec implements. */
    CompressionMode mode();

    /**
     * Compresses the input buffer.
     *
     * @throws CompressionException if the underlying stream fails
     */
    byte[] encode(byte[] input);

    /**
     * Decompresses the input buffer.
     *
     * @throws CompressionException if the input is not a valid stream for this codec
     */
    byte[] decode(byte[] input);
}
