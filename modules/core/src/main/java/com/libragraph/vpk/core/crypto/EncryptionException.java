package com.libragraph.vpk.core.crypto;

import com.libragraph.vpk.util.VpkException;

/**
 * Wraps cipher failures while sealing a payload.
 */
public class EncryptionException extends VpkException {

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    public EncryptionException(String message) {
        super(message);
    }
}
