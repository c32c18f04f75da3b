package com.libragraph.vpk.core.crypto;

/**
 * The integrity tag of an authenticated envelope did not verify.
 * The ciphertext, nonce or tag was altered, or the key is wrong. No plaintext is released.
 */
public class AuthenticationFailedException extends DecryptionException {

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
