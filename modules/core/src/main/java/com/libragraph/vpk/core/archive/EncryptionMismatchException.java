package com.libragraph.vpk.core.archive;

import com.libragraph.vpk.util.VpkException;

import java.nio.file.Path;

/**
 * The archive was written with a different encryption mode than this pipeline uses.
 */
public class EncryptionMismatchException extends VpkException {

    private final Path path;
    private final String expected;
    private final String actual;

    public EncryptionMismatchException(Path path, String expected, String actual) {
        super("Archive " + path + " uses encryption '" + actual + "', expected '" + expected + "'");
        this.path = path;
        this.expected = expected;
        this.actual = actual;
    }

    public Path path() {
        return path;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
