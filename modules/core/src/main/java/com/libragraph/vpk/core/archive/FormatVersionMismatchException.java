package com.libragraph.vpk.core.archive;

import com.libragraph.vpk.util.VpkException;

import java.nio.file.Path;

/**
 * Raised on format version skew, only when {@code vpk.package.strict-version} is on.
 * Otherwise skew is logged as a warning.
 */
public class FormatVersionMismatchException extends VpkException {

    private final Path path;
    private final long expected;
    private final long actual;

    public FormatVersionMismatchException(Path path, long expected, long actual) {
        super("Archive " + path + " has format version " + actual + ", expected " + expected);
        this.path = path;
        this.expected = expected;
        this.actual = actual;
    }

    public Path path() {
        return path;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}
