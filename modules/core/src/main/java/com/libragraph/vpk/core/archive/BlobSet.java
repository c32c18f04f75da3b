package com.libragraph.vpk.core.archive;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Logical content of an archive: relative path to raw bytes.
 *
 * <p>Insertion order is kept and survives a save/read cycle. Equality compares
 * entries by path and byte content.
 */
public final class BlobSet {

    private final Map<String, byte[]> entries = new LinkedHashMap<>();

    public BlobSet() {
    }

    public static BlobSet of(Map<String, byte[]> content) {
        BlobSet set = new BlobSet();
        content.forEach(set::put);
        return set;
    }

    /** Adds or replaces an entry. The bytes are copied. */
    public BlobSet put(String path, byte[] content) {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(content, "content cannot be null for " + path);
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        entries.put(path, Arrays.copyOf(content, content.length));
        return this;
    }

    /** Returns a copy of the entry's bytes. */
    public Optional<byte[]> get(String path) {
        byte[] content = entries.get(path);
        return content == null ? Optional.empty() : Optional.of(Arrays.copyOf(content, content.length));
    }

    public boolean contains(String path) {
        return entries.containsKey(path);
    }

    public Set<String> paths() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Sum of all entry lengths. */
    public long totalBytes() {
        long total = 0;
        for (byte[] content : entries.values()) {
            total += content.length;
        }
        return total;
    }

    /**
     * Merges {@code patch} into this set: its entries replace existing ones with
     * the same path, new paths are appended, nothing is removed.
     */
    public BlobSet merge(BlobSet patch) {
        patch.entries.forEach(this::put);
        return this;
    }

    /** Read-only view; the arrays must not be modified. */
    Map<String, byte[]> view() {
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BlobSet other)) return false;
        if (entries.size() != other.entries.size()) return false;
        for (Map.Entry<String, byte[]> e : entries.entrySet()) {
            byte[] theirs = other.entries.get(e.getKey());
            if (theirs == null || !Arrays.equals(e.getValue(), theirs)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<String, byte[]> e : entries.entrySet()) {
            h += e.getKey().hashCode() ^ Arrays.hashCode(e.getValue());
        }
        return h;
    }

    @Override
    public String toString() {
        return "BlobSet[" + entries.size() + " entries, " + totalBytes() + " bytes]";
    }
}
