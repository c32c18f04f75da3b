package com.libragraph.vpk.formats.container;

import java.time.Instant;
import java.util.Objects;

/**
 * Fixed-width record at the start of every archive file.
 *
 * <p>String fields hold whatever the file carries (mode names are not validated
 * here, so archives written with unknown modes can still be probed). Unsigned
 * 32-bit header fields are carried as {@code long}.
 *
 * @param name          archive name, derived from the file name
 * @param description   free text
 * @param payloadSize   exact byte length of everything after the header
 * @param author        author constant of the writer
 * @param copyright     copyright constant of the writer
 * @param timestamp     creation time, unix seconds
 * @param encryption    encryption mode label, e.g. {@code AES-GCM}
 * @param keyLength     length in bytes of the key that sealed the payload
 * @param formatVersion container format version of the writer
 * @param compression   compression codec label, e.g. {@code zstd}
 */
public record ArchiveHeader(
        String name,
        String description,
        long payloadSize,
        String author,
        String copyright,
        long timestamp,
        String encryption,
        long keyLength,
        long formatVersion,
        String compression) {

    public ArchiveHeader {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(author, "author cannot be null");
        Objects.requireNonNull(copyright, "copyright cannot be null");
        Objects.requireNonNull(encryption, "encryption cannot be null");
        Objects.requireNonNull(compression, "compression cannot be null");
    }

    public Instant createdAt() {
        return Instant.ofEpochSecond(timestamp);
    }

    /** Total file size implied by this header. */
    public long archiveSize() {
        return HeaderCodec.HEADER_SIZE + payloadSize;
    }
}
