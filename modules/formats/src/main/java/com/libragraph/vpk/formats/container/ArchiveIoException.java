package com.libragraph.vpk.formats.container;

import com.libragraph.vpk.util.VpkException;

import java.nio.file.Path;

/**
 * Wraps I/O failures and framing problems (truncated header or payload)
 * while reading or writing an archive file.
 */
public class ArchiveIoException extends VpkException {

    private final Path path;

    public ArchiveIoException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public ArchiveIoException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    /** Framing problem in an in-memory buffer; {@link #path()} is {@code null}. */
    public ArchiveIoException(String message) {
        super(message);
        this.path = null;
    }

    public Path path() {
        return path;
    }
}
