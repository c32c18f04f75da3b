package com.libragraph.vpk.core.crypto;

import com.libragraph.vpk.types.EncryptionMode;

/**
 * One AES mode. Implementations draw a fresh nonce or IV on every
 * {@link #encrypt} call and never reuse one.
 */
public interface Encryptor {

    EncryptionMode mode();

    /** Required nonce/IV length in bytes. */
    int nonceLength();

    /**
     * @param key raw AES key (16, 24 or 32 bytes)
     * @throws EncryptionException on cipher failure
     */
    EncryptedEnvelope encrypt(byte[] key, byte[] plaintext);

    /**
     * @throws AuthenticationFailedException if an integrity tag does not verify
     * @throws DecryptionException           on malformed envelopes or cipher failure
     */
    byte[] decrypt(byte[] key, EncryptedEnvelope envelope);
}
