package com.libragraph.vpk.core.archive;

import com.libragraph.vpk.util.VpkException;

import java.nio.file.Path;

/**
 * The archive was written with a different compression mode than this pipeline uses.
 */
public class CompressionMismatchException extends VpkException {

    private final Path path;
    private final String expected;
    private final String actual;

    public CompressionMismatchException(Path path, String expected, String actual) {
        super("Archive " + path + " uses compression '" + actual + "', expected '" + expected + "'");
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
