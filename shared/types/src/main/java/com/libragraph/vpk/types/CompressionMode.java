package com.libragraph.vpk.types;

import java.util.Optional;

/**
 * Compression codecs an archive payload can be shrunk with.
 * The label is what the archive header records.
 */
public enum CompressionMode {
    GZIP("gzip"),
    BZIP2("bzip2"),
    LZMA("lzma"),
    LZ4("lz4"),
    ZSTD("zstd"),
    NONE("none");

    private final String label;

    CompressionMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<CompressionMode> findByLabel(String label) {
        for (CompressionMode m : values()) {
            if (m.label.equals(label)) return Optional.of(m);
        }
        return Optional.empty();
    }

    public static CompressionMode fromLabel(String label) {
        return findByLabel(label)
                .orElseThrow(() -> new IllegalArgumentException("Unknown CompressionMode label: " + label));
    }
}
