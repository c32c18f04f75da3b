package com.libragraph.vpk.util;

import java.nio.file.Path;

/**
 * Thrown when a directory cannot be listed or one of its files cannot be read.
 */
public class DirectoryReadException extends VpkException {

    private final Path path;

    public DirectoryReadException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public DirectoryReadException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
