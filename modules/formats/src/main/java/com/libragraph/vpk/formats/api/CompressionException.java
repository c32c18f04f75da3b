package com.libragraph.vpk.formats.api;

import com.libragraph.vpk.util.VpkException;

/**
 * Wraps stream failures from a codec: corrupt input, truncated frames, I/O errors.
 */
public class CompressionException extends VpkException {

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }

    public CompressionException(String message) {
        super(message);
    }
}
