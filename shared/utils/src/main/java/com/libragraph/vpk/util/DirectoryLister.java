package com.libragraph.vpk.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the regular files below a directory.
 */
public final class DirectoryLister {

    private DirectoryLister() {
    }

    /**
     * Returns absolute paths of every regular file under {@code root}, including
     * nested subdirectories, sorted by path. Directories themselves are not listed.
     *
     * @throws DirectoryReadException if {@code root} is not a directory or cannot be walked
     */
    public static List<Path> listFiles(Path root) {
        if (!Files.isDirectory(root)) {
            throw new DirectoryReadException(root, "Not a directory");
        }
        Path absolute = root.toAbsolutePath().normalize();
        try (Stream<Path> walk = Files.walk(absolute)) {
            return walk.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new DirectoryReadException(root, "Failed to list directory", e);
        }
    }

    /**
     * Path of {@code file} relative to {@code root}, always '/'-separated.
     */
    public static String relativeName(Path root, Path file) {
        Path relative = root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        StringBuilder sb = new StringBuilder();
        for (Path part : relative) {
            if (sb.length() > 0) sb.append('/');
            sb.append(part);
        }
        return sb.toString();
    }
}
