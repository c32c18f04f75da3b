package com.libragraph.vpk.util;

/**
 * Root of all archive, codec and crypto failures.
 * Unchecked; the low-level cause is always chained when there is one.
 */
public class VpkException extends RuntimeException {

    public VpkException(String message, Throwable cause) {
        super(message, cause);
    }

    public VpkException(String message) {
        super(message);
    }
}
