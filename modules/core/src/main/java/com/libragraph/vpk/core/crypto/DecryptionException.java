package com.libragraph.vpk.core.crypto;

import com.libragraph.vpk.util.VpkException;

/**
 * Wraps failures while opening a payload: malformed envelope, wrong key, bad padding.
 */
public class DecryptionException extends VpkException {

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    public DecryptionException(String message) {
        super(message);
    }
}
