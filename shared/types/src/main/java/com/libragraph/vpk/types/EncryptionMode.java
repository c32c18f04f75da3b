package com.libragraph.vpk.types;

import java.util.Optional;

/**
 * AES modes an archive payload can be sealed with.
 *
 * <p>The ordinal id and the label are both part of the on-disk contract:
 * the label is stored in the archive header, the id mirrors the numbering
 * used by older tooling.
 */
public enum EncryptionMode {
    AES_GCM(0, "AES-GCM", true),
    AES_CTR(1, "AES-CTR", false),
    AES_CBC(2, "AES-CBC", false);

    private final int id;
    private final String label;
    private final boolean authenticated;

    EncryptionMode(int id, String label, boolean authenticated) {
        this.id = id;
        this.label = label;
        this.authenticated = authenticated;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    /** True when the mode produces an integrity tag and detects tampering. */
    public boolean authenticated() {
        return authenticated;
    }

    public static EncryptionMode fromId(int id) {
        for (EncryptionMode m : values()) {
            if (m.id == id) return m;
        }
        throw new IllegalArgumentException("Unknown EncryptionMode id: " + id);
    }

    public static Optional<EncryptionMode> findByLabel(String label) {
        for (EncryptionMode m : values()) {
            if (m.label.equals(label)) return Optional.of(m);
        }
        return Optional.empty();
    }

    public static EncryptionMode fromLabel(String label) {
        return findByLabel(label)
                .orElseThrow(() -> new IllegalArgumentException("Unknown EncryptionMode label: " + label));
    }
}
