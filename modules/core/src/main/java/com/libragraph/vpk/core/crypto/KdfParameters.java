package com.libragraph.vpk.core.crypto;

/**
 * Argon2id tunables.
 *
 * @param keyLength     derived key length in bytes
 * @param timeCost      number of passes over memory
 * @param memoryCostKib memory in KiB
 * @param parallelism   number of lanes
 */
public record KdfParameters(int keyLength, int timeCost, int memoryCostKib, int parallelism) {

    /** 32-byte key, 2 passes, 100 * 100 KiB of memory, 8 lanes. */
    public static final KdfParameters DEFAULTS = new KdfParameters(32, 2, 100 * 100, 8);

    public KdfParameters withKeyLength(int length) {
        return new KdfParameters(length, timeCost, memoryCostKib, parallelism);
    }
}
