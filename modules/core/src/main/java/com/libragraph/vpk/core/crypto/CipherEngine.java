package com.libragraph.vpk.core.crypto;

import com.libragraph.vpk.types.EncryptionMode;
import com.libragraph.vpk.util.KeyMaterial;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.security.SecureRandom;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches encrypt/decrypt calls to the {@link Encryptor} of the requested mode.
 */
@ApplicationScoped
public class CipherEngine {

    private static final Logger log = Logger.getLogger(CipherEngine.class);

    private final Map<EncryptionMode, Encryptor> encryptors = new EnumMap<>(EncryptionMode.class);

    public CipherEngine() {
        this(new SecureRandom());
    }

    CipherEngine(SecureRandom random) {
        this(List.of(
                new AesGcmEncryptor(random),
                new AesCtrEncryptor(random),
                new AesCbcEncryptor(random)));
    }

    CipherEngine(List<Encryptor> available) {
        for (Encryptor e : available) {
            encryptors.put(e.mode(), e);
        }
        for (EncryptionMode mode : EncryptionMode.values()) {
            if (!encryptors.containsKey(mode)) {
                throw new IllegalStateException("No encryptor registered for mode " + mode);
            }
        }
    }

    public Encryptor encryptor(EncryptionMode mode) {
        return encryptors.get(mode);
    }

    /**
     * Seals {@code plaintext} under a fresh nonce.
     *
     * @throws EncryptionException if the key has an invalid AES length or the cipher fails
     */
    public EncryptedEnvelope encrypt(KeyMaterial key, byte[] plaintext, EncryptionMode mode) {
        if (!validAesLength(key.length())) {
            throw new EncryptionException("AES key must be 16, 24 or 32 bytes, got: " + key.length());
        }
        EncryptedEnvelope envelope = encryptors.get(mode).encrypt(key.bytes(), plaintext);
        log.debugf("Encrypted %d bytes with %s", plaintext.length, mode.label());
        return envelope;
    }

    /**
     * Opens an envelope produced by {@link #encrypt} with the same mode.
     *
     * @throws AuthenticationFailedException if the mode is authenticated and the tag does not verify
     * @throws DecryptionException           on malformed envelopes, invalid keys or cipher failure
     */
    public byte[] decrypt(KeyMaterial key, EncryptedEnvelope envelope, EncryptionMode mode) {
        if (!validAesLength(key.length())) {
            throw new DecryptionException("AES key must be 16, 24 or 32 bytes, got: " + key.length());
        }
        try {
            byte[] plaintext = encryptors.get(mode).decrypt(key.bytes(), envelope);
            log.debugf("Decrypted %d bytes with %s", plaintext.length, mode.label());
            return plaintext;
        } catch (IllegalArgumentException e) {
            // hex parsing of a damaged envelope
            throw new DecryptionException("Malformed " + mode.label() + " envelope", e);
        }
    }

    private static boolean validAesLength(int length) {
        return length == 16 || length == 24 || length == 32;
    }
}
