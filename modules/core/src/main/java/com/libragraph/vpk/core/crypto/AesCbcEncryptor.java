package com.libragraph.vpk.core.crypto;

import com.libragraph.vpk.types.EncryptionMode;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-CBC with a random 16-byte IV and PKCS#7 padding. No integrity check;
 * a wrong key usually surfaces as a padding failure, but that is not guaranteed.
 */
public class AesCbcEncryptor implements Encryptor {

    private static final int IV_BYTES = 16;

    private final SecureRandom random;

    public AesCbcEncryptor(SecureRandom random) {
        this.random = random;
    }

    @Override
    public EncryptionMode mode() {
        return EncryptionMode.AES_CBC;
    }

    @Override
    public int nonceLength() {
        return IV_BYTES;
    }

    @Override
    public EncryptedEnvelope encrypt(byte[] key, byte[] plaintext) {
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
            return EncryptedEnvelope.of(cipher.doFinal(plaintext), iv, null);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("AES-CBC encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] key, EncryptedEnvelope envelope) {
        byte[] iv = envelope.ivBytes();
        if (iv.length != IV_BYTES) {
            throw new DecryptionException("AES-CBC IV must be " + IV_BYTES + " bytes, got: " + iv.length);
        }
        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
            return cipher.doFinal(envelope.ciphertextBytes());
        } catch (BadPaddingException e) {
            throw new DecryptionException("AES-CBC padding check failed (wrong key or corrupt data)", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("AES-CBC decryption failed", e);
        }
    }
}
