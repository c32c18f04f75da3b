package com.libragraph.vpk.core.archive;

/**
 * Stages a pipeline operation passes through. Reads go
 * {@code VALIDATING -> DECOMPRESSING -> DECRYPTING}, writes go
 * {@code VALIDATING -> ENCRYPTING -> COMPRESSING}.
 */
public enum PipelineStage {
    IDLE,
    VALIDATING,
    DECOMPRESSING,
    DECRYPTING,
    ENCRYPTING,
    COMPRESSING,
    DONE,
    FAILED
}
