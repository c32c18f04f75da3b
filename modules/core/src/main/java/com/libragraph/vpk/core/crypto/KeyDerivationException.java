package com.libragraph.vpk.core.crypto;

import com.libragraph.vpk.util.VpkException;

/**
 * Thrown for invalid key derivation parameters. Not retried.
 */
public class KeyDerivationException extends VpkException {

    public KeyDerivationException(String message, Throwable cause) {
        super(message, cause);
    }

    public KeyDerivationException(String message) {
        super(message);
    }
}
