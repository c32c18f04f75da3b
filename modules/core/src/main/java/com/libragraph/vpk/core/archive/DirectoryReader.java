package com.libragraph.vpk.core.archive;

import com.libragraph.vpk.util.DirectoryLister;
import com.libragraph.vpk.util.DirectoryReadException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads listed files into a {@link BlobSet} keyed by their path relative to the root.
 *
 * <p>With more than one thread the reads run on a fixed pool created per call;
 * the resulting entry order is always the order of {@code files}.
 */
class DirectoryReader {

    private static final Logger log = Logger.getLogger(DirectoryReader.class);

    private final int threads;

    DirectoryReader(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        this.threads = threads;
    }

    BlobSet read(Path root, List<Path> files) {
        if (threads == 1 || files.size() < 2) {
            BlobSet blobs = new BlobSet();
            for (Path file : files) {
                blobs.put(DirectoryLister.relativeName(root, file), readFile(file));
            }
            return blobs;
        }
        return readParallel(root, files);
    }

    private BlobSet readParallel(Path root, List<Path> files) {
        int poolSize = Math.min(threads, files.size());
        log.debugf("Reading %d files from %s with %d threads",
                Integer.valueOf(files.size()), root, Integer.valueOf(poolSize));

        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "vpk-reader-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<byte[]>> pending = new ArrayList<>(files.size());
            for (Path file : files) {
                pending.add(pool.submit(() -> readFile(file)));
            }
            BlobSet blobs = new BlobSet();
            for (int i = 0; i < files.size(); i++) {
                Path file = files.get(i);
                blobs.put(DirectoryLister.relativeName(root, file), await(pending.get(i), file));
            }
            return blobs;
        } finally {
            pool.shutdownNow();
        }
    }

    private static byte[] await(Future<byte[]> future, Path file) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof DirectoryReadException dre) {
                throw dre;
            }
            throw new DirectoryReadException(file, "Failed to read file", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DirectoryReadException(file, "Interrupted while reading file", e);
        }
    }

    private static byte[] readFile(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new DirectoryReadException(file, "Failed to read file", e);
        }
    }
}
