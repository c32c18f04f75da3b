package com.libragraph.vpk.core.crypto;

import com.libragraph.vpk.types.EncryptionMode;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES in counter mode. No integrity check: corruption goes undetected here.
 *
 * <p>The envelope carries an 8-byte nonce; the counter block is the nonce
 * followed by a 64-bit big-endian block counter starting at zero.
 */
public class AesCtrEncryptor implements Encryptor {

    private static final int NONCE_BYTES = 8;
    private static final int BLOCK_BYTES = 16;

    private final SecureRandom random;

    public AesCtrEncryptor(SecureRandom random) {
        this.random = random;
    }

    @Override
    public EncryptionMode mode() {
        return EncryptionMode.AES_CTR;
    }

    @Override
    public int nonceLength() {
        return NONCE_BYTES;
    }

    @Override
    public EncryptedEnvelope encrypt(byte[] key, byte[] plaintext) {
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        try {
            return EncryptedEnvelope.of(apply(Cipher.ENCRYPT_MODE, key, nonce, plaintext), nonce, null);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("AES-CTR encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] key, EncryptedEnvelope envelope) {
        byte[] nonce = envelope.ivBytes();
        if (nonce.length != NONCE_BYTES) {
            throw new DecryptionException("AES-CTR nonce must be " + NONCE_BYTES + " bytes, got: " + nonce.length);
        }
        try {
            return apply(Cipher.DECRYPT_MODE, key, nonce, envelope.ciphertextBytes());
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("AES-CTR decryption failed", e);
        }
    }

    private static byte[] apply(int opmode, byte[] key, byte[] nonce, byte[] input) throws GeneralSecurityException {
        byte[] counterBlock = Arrays.copyOf(nonce, BLOCK_BYTES);
        Cipher cipher = Cipher.getInstance("AES/CTR/NoPadding");
        cipher.init(opmode, new SecretKeySpec(key, "AES"), new IvParameterSpec(counterBlock));
        return cipher.doFinal(input);
    }
}
