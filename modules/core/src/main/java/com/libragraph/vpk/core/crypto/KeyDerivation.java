package com.libragraph.vpk.core.crypto;

import com.libragraph.vpk.util.KeyMaterial;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Derives symmetric keys from low-entropy secrets with Argon2id (v1.3).
 *
 * <p>Derivation is deterministic, so a key can be re-derived from the same
 * secret and salt instead of being stored.
 */
public final class KeyDerivation {

    /** Minimum salt length accepted by the Argon2 reference implementation. */
    static final int MIN_SALT_BYTES = 8;
    static final int MIN_KEY_BYTES = 4;
    static final int MAX_PARALLELISM = 0xFFFFFF;

    private KeyDerivation() {
    }

    public static KeyMaterial derive(String secret, String salt) {
        return derive(secret, salt, KdfParameters.DEFAULTS);
    }

    /**
     * Derives a key of {@code params.keyLength()} bytes.
     *
     * @throws KeyDerivationException if the inputs or parameters are invalid
     */
    public static KeyMaterial derive(String secret, String salt, KdfParameters params) {
        if (secret == null || secret.isEmpty()) {
            throw new KeyDerivationException("Secret must not be empty");
        }
        if (salt == null) {
            throw new KeyDerivationException("Salt must not be null");
        }
        byte[] saltBytes = salt.getBytes(StandardCharsets.UTF_8);
        validate(params, saltBytes.length);

        Argon2Parameters argon2 = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withSalt(saltBytes)
                .withIterations(params.timeCost())
                .withMemoryAsKB(params.memoryCostKib())
                .withParallelism(params.parallelism())
                .build();

        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[params.keyLength()];
        try {
            Argon2BytesGenerator generator = new Argon2BytesGenerator();
            generator.init(argon2);
            generator.generateBytes(secretBytes, out);
            return new KeyMaterial(out);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new KeyDerivationException("Argon2id rejected parameters " + params, e);
        } finally {
            Arrays.fill(secretBytes, (byte) 0);
            Arrays.fill(out, (byte) 0);
        }
    }

    /**
     * Derives the key bound to a machine identifier: the identifier doubled is
     * the secret and the identifier itself is the salt.
     */
    public static KeyMaterial deriveForMachine(String machineId) {
        return deriveForMachine(machineId, KdfParameters.DEFAULTS);
    }

    public static KeyMaterial deriveForMachine(String machineId, KdfParameters params) {
        if (machineId == null || machineId.isBlank()) {
            throw new KeyDerivationException("Machine identifier must not be blank");
        }
        return derive(machineId + machineId, machineId, params);
    }

    private static void validate(KdfParameters p, int saltLength) {
        if (p.keyLength() < MIN_KEY_BYTES) {
            throw new KeyDerivationException("Key length must be >= " + MIN_KEY_BYTES + ", got: " + p.keyLength());
        }
        if (p.timeCost() < 1) {
            throw new KeyDerivationException("Time cost must be >= 1, got: " + p.timeCost());
        }
        if (p.parallelism() < 1 || p.parallelism() > MAX_PARALLELISM) {
            throw new KeyDerivationException("Parallelism must be 1.." + MAX_PARALLELISM + ", got: " + p.parallelism());
        }
        if (p.memoryCostKib() < 8 * p.parallelism()) {
            throw new KeyDerivationException("Memory cost must be >= 8 KiB per lane ("
                    + 8 * p.parallelism() + " KiB), got: " + p.memoryCostKib());
        }
        if (saltLength < MIN_SALT_BYTES) {
            throw new KeyDerivationException("Salt must be >= " + MIN_SALT_BYTES + " bytes, got: " + saltLength);
        }
    }
}
