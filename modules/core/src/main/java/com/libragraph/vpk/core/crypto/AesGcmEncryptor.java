package com.libragraph.vpk.core.crypto;

import com.libragraph.vpk.types.EncryptionMode;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-GCM authenticated encryption. The only mode that detects tampering.
 *
 * <p>Uses a 16-byte nonce and a 128-bit tag, carried separately in the envelope
 * (the JCE appends the tag to the ciphertext; it is split off here).
 */
public class AesGcmEncryptor implements Encryptor {

    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_TAG_BYTES = GCM_TAG_BITS / 8;
    private static final int GCM_NONCE_BYTES = 16;

    private final SecureRandom random;

    public AesGcmEncryptor(SecureRandom random) {
        this.random = random;
    }

    @Override
    public EncryptionMode mode() {
        return EncryptionMode.AES_GCM;
    }

    @Override
    public int nonceLength() {
        return GCM_NONCE_BYTES;
    }

    @Override
    public EncryptedEnvelope encrypt(byte[] key, byte[] plaintext) {
        byte[] nonce = new byte[GCM_NONCE_BYTES];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE,
                    new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(GCM_TAG_BITS, nonce));
            byte[] sealed = cipher.doFinal(plaintext);
            int split = sealed.length - GCM_TAG_BYTES;
            return EncryptedEnvelope.of(
                    Arrays.copyOfRange(sealed, 0, split),
                    nonce,
                    Arrays.copyOfRange(sealed, split, sealed.length));
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("AES-GCM encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] key, EncryptedEnvelope envelope) {
        if (!envelope.hasTag()) {
            throw new DecryptionException("AES-GCM envelope has no tag");
        }
        byte[] nonce = envelope.ivBytes();
        byte[] ciphertext = envelope.ciphertextBytes();
        byte[] tag = envelope.tagBytes();
        if (nonce.length != GCM_NONCE_BYTES) {
            throw new DecryptionException("AES-GCM nonce must be " + GCM_NONCE_BYTES + " bytes, got: " + nonce.length);
        }
        if (tag.length != GCM_TAG_BYTES) {
            throw new DecryptionException("AES-GCM tag must be " + GCM_TAG_BYTES + " bytes, got: " + tag.length);
        }

        byte[] sealed = Arrays.copyOf(ciphertext, ciphertext.length + tag.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE,
                    new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(GCM_TAG_BITS, nonce));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailedException("AES-GCM tag verification failed", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("AES-GCM decryption failed", e);
        }
    }
}
