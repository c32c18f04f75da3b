package com.libragraph.vpk.util;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Derived symmetric key. Immutable value object.
 *
 * <p>The bytes are copied on the way in and on the way out, and
 * {@link #toString()} never prints them.
 */
public final class KeyMaterial {
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    private final byte[] bytes;

    public KeyMaterial(byte[] bytes) {
        Objects.requireNonNull(bytes, "Key bytes cannot be null");
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Key must not be empty");
        }
        this.bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Creates KeyMaterial from a hex string.
     */
    public static KeyMaterial fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        try {
            return new KeyMaterial(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex key", e);
        }
    }

    /** Returns a copy of the key bytes. */
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int length() {
        return bytes.length;
    }

    /** Lowercase hex of the key. Only for callers that persist keys themselves. */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof KeyMaterial other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "KeyMaterial[" + bytes.length + " bytes]";
    }
}
