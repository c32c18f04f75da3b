package com.libragraph.vpk.core.archive;

import com.libragraph.vpk.core.crypto.CipherEngine;
import com.libragraph.vpk.core.crypto.EncryptedEnvelope;
import com.libragraph.vpk.formats.container.ArchiveHeader;
import com.libragraph.vpk.formats.container.ArchiveIoException;
import com.libragraph.vpk.formats.container.HeaderCodec;
import com.libragraph.vpk.formats.registry.CodecRegistry;
import com.libragraph.vpk.util.DirectoryLister;
import com.libragraph.vpk.util.KeyMaterial;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reads and writes {@code .vpk} archives.
 *
 * <p>Write path: blob set → JSON payload → encrypt → JSON envelope → compress →
 * header ‖ payload. The read path is the exact reverse. Every archive is
 * rewritten whole; writes land in a temp file next to the target and are moved
 * into place, so a failed write never leaves a partial archive.
 *
 * <p>An instance holds no mutable state and may be shared.
 */
public class PackagePipeline {

    public static final String EXTENSION = ".vpk";

    private final KeyMaterial key;
    private final PackageSettings settings;
    private final Logger log;
    private final Clock clock;
    private final CipherEngine cipherEngine;
    private final CodecRegistry codecRegistry;
    private final PayloadCodec payloadCodec;
    private final DirectoryReader directoryReader;

    public PackagePipeline(KeyMaterial key) {
        this(key, PackageSettings.defaults());
    }

    public PackagePipeline(KeyMaterial key, PackageSettings settings) {
        this(key, settings, null);
    }

    /**
     * @param log destination for stage and warning messages; {@code null} uses the class logger
     */
    public PackagePipeline(KeyMaterial key, PackageSettings settings, Logger log) {
        this(key, settings, log, Clock.systemUTC());
    }

    PackagePipeline(KeyMaterial key, PackageSettings settings, Logger log, Clock clock) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.log = log != null ? log : Logger.getLogger(PackagePipeline.class);
        this.clock = clock;
        this.cipherEngine = new CipherEngine();
        this.codecRegistry = new CodecRegistry();
        this.payloadCodec = new PayloadCodec();
        this.directoryReader = new DirectoryReader(settings.readThreads());
    }

    public PackageSettings settings() {
        return settings;
    }

    /**
     * Packs every file under {@code directory} into {@code directory/<dirname>.vpk}.
     */
    public Path create(Path directory) {
        return create(directory, defaultArchivePath(directory));
    }

    /**
     * Packs every file under {@code directory}, keyed by its '/'-separated relative
     * path, into {@code archivePath}. The archive itself is skipped if it lies
     * inside the directory.
     */
    public Path create(Path directory, Path archivePath) {
        Operation op = begin("create", archivePath);
        try {
            op.advance(PipelineStage.VALIDATING);
            Path target = archivePath.toAbsolutePath().normalize();
            List<Path> files = DirectoryLister.listFiles(directory).stream()
                    .filter(f -> !f.equals(target))
                    .collect(Collectors.toList());
            log.infof("Packing %d files from %s into %s", files.size(), directory, archivePath);
            BlobSet blobs = directoryReader.read(directory, files);
            Path written = save(blobs, archivePath);
            op.advance(PipelineStage.DONE);
            return written;
        } catch (RuntimeException e) {
            throw op.fail(e);
        }
    }

    /**
     * Seals {@code blobs} into a new archive at {@code archivePath}, replacing any existing file.
     *
     * @return the archive path
     */
    public Path save(BlobSet blobs, Path archivePath) {
        Operation op = begin("save", archivePath);
        try {
            op.advance(PipelineStage.VALIDATING);
            String name = archiveName(archivePath);
            // reject oversized header strings before doing any crypto
            HeaderCodec.encode(header(name, 0));

            op.advance(PipelineStage.ENCRYPTING);
            byte[] plaintext = payloadCodec.writeBlobSet(blobs);
            EncryptedEnvelope envelope = cipherEngine.encrypt(key, plaintext, settings.encryption());
            byte[] envelopeBytes = payloadCodec.writeEnvelope(envelope);

            op.advance(PipelineStage.COMPRESSING);
            byte[] payload = codecRegistry.compress(envelopeBytes, settings.compression());
            byte[] header = HeaderCodec.encode(header(name, payload.length));

            writeAtomically(archivePath, header, payload);
            log.debugf("Wrote %s: %d entries, %d payload bytes", archivePath, blobs.size(), payload.length);
            op.advance(PipelineStage.DONE);
            return archivePath;
        } catch (RuntimeException e) {
            throw op.fail(e);
        }
    }

    /**
     * Opens an archive written with this pipeline's modes and key.
     *
     * @throws EncryptionMismatchException  if the archive uses another encryption mode
     * @throws CompressionMismatchException if the archive uses another codec
     * @throws ArchiveIoException           if the file length does not match the header
     */
    public BlobSet read(Path archivePath) {
        Operation op = begin("read", archivePath);
        try {
            op.advance(PipelineStage.VALIDATING);
            ArchiveHeader header = verify(archivePath, HeaderCodec.probe(archivePath));
            byte[] payload = readPayload(archivePath, header);

            op.advance(PipelineStage.DECOMPRESSING);
            byte[] envelopeBytes = codecRegistry.decompress(payload, settings.compression());

            op.advance(PipelineStage.DECRYPTING);
            EncryptedEnvelope envelope = payloadCodec.readEnvelope(envelopeBytes);
            byte[] plaintext = cipherEngine.decrypt(key, envelope, settings.encryption());
            BlobSet blobs = payloadCodec.readBlobSet(plaintext);

            op.advance(PipelineStage.DONE);
            return blobs;
        } catch (RuntimeException e) {
            throw op.fail(e);
        }
    }

    /**
     * Reads the archive, merges {@code patch} over it and saves it back in place.
     * Entries missing from the patch are kept.
     */
    public Path update(BlobSet patch, Path archivePath) {
        Operation op = begin("update", archivePath);
        try {
            op.advance(PipelineStage.VALIDATING);
            BlobSet current = read(archivePath);
            current.merge(patch);
            log.debugf("Updating %s with %d entries", archivePath, patch.size());
            Path written = save(current, archivePath);
            op.advance(PipelineStage.DONE);
            return written;
        } catch (RuntimeException e) {
            throw op.fail(e);
        }
    }

    /** Header of an archive; the payload is not read. */
    public ArchiveHeader info(Path archivePath) {
        Operation op = begin("info", archivePath);
        try {
            op.advance(PipelineStage.VALIDATING);
            ArchiveHeader header = HeaderCodec.probe(archivePath);
            op.advance(PipelineStage.DONE);
            return header;
        } catch (RuntimeException e) {
            throw op.fail(e);
        }
    }

    /**
     * Verifies that an archive can be opened by this pipeline.
     *
     * @return the archive header
     */
    public ArchiveHeader check(Path archivePath) {
        Operation op = begin("check", archivePath);
        try {
            op.advance(PipelineStage.VALIDATING);
            ArchiveHeader header = verify(archivePath, HeaderCodec.probe(archivePath));
            op.advance(PipelineStage.DONE);
            return header;
        } catch (RuntimeException e) {
            throw op.fail(e);
        }
    }

    Path defaultArchivePath(Path directory) {
        Path dir = directory.toAbsolutePath().normalize();
        Path fileName = dir.getFileName();
        String name = fileName == null || fileName.toString().isBlank()
                ? settings.defaultName()
                : fileName.toString();
        return dir.resolve(name + EXTENSION);
    }

    static String archiveName(Path archivePath) {
        Path fileName = archivePath.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Archive path has no file name: " + archivePath);
        }
        String name = fileName.toString();
        return name.endsWith(EXTENSION) ? name.substring(0, name.length() - EXTENSION.length()) : name;
    }

    private ArchiveHeader verify(Path archivePath, ArchiveHeader header) {
        String encryption = settings.encryption().label();
        if (!encryption.equals(header.encryption())) {
            throw new EncryptionMismatchException(archivePath, encryption, header.encryption());
        }
        if (header.formatVersion() != settings.formatVersion()) {
            if (settings.strictVersion()) {
                throw new FormatVersionMismatchException(archivePath, settings.formatVersion(), header.formatVersion());
            }
            log.warnf("Archive %s has format version %d, this writer uses %d",
                    archivePath, header.formatVersion(), settings.formatVersion());
        }
        String compression = settings.compression().label();
        if (!compression.equals(header.compression())) {
            throw new CompressionMismatchException(archivePath, compression, header.compression());
        }
        if (header.keyLength() != key.length()) {
            log.warnf("Archive %s was sealed with a %d-byte key, pipeline key is %d bytes",
                    archivePath, header.keyLength(), key.length());
        }
        return header;
    }

    private ArchiveHeader header(String name, long payloadSize) {
        return new ArchiveHeader(
                name,
                settings.description(),
                payloadSize,
                settings.author(),
                settings.copyright(),
                clock.instant().getEpochSecond(),
                settings.encryption().label(),
                key.length(),
                settings.formatVersion(),
                settings.compression().label());
    }

    private static byte[] readPayload(Path archivePath, ArchiveHeader header) {
        if (header.payloadSize() > Integer.MAX_VALUE - 8) {
            throw new ArchiveIoException(archivePath, "Payload of " + header.payloadSize() + " bytes is too large");
        }
        try (FileChannel in = FileChannel.open(archivePath, StandardOpenOption.READ)) {
            long size = in.size();
            if (size != header.archiveSize()) {
                throw new ArchiveIoException(archivePath,
                        "Archive is " + size + " bytes, header declares " + header.archiveSize());
            }
            ByteBuffer buf = ByteBuffer.allocate((int) header.payloadSize());
            in.position(HeaderCodec.HEADER_SIZE);
            while (buf.hasRemaining()) {
                if (in.read(buf) < 0) {
                    throw new ArchiveIoException(archivePath,
                            "Unexpected end of payload after " + buf.position() + " bytes");
                }
            }
            return buf.array();
        } catch (IOException e) {
            throw new ArchiveIoException(archivePath, "Failed to read archive payload", e);
        }
    }

    private void writeAtomically(Path target, byte[] header, byte[] payload) {
        Path dir = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            try (FileChannel out = FileChannel.open(temp,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                writeFully(out, ByteBuffer.wrap(header));
                writeFully(out, ByteBuffer.wrap(payload));
                out.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debugf("Atomic move not supported in %s, replacing %s", dir, target.getFileName());
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new ArchiveIoException(target, "Failed to write archive", e);
        }
    }

    private static void writeFully(FileChannel out, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) {
            out.write(buf);
        }
    }

    private Operation begin(String name, Path archivePath) {
        return new Operation(name, archivePath);
    }

    /** Stage tracker for one call; logs each transition. */
    private final class Operation {
        private final String name;
        private final Path archivePath;
        private PipelineStage stage = PipelineStage.IDLE;

        Operation(String name, Path archivePath) {
            this.name = name;
            this.archivePath = archivePath;
        }

        void advance(PipelineStage next) {
            log.debugf("%s %s: %s -> %s", name, archivePath, stage, next);
            stage = next;
        }

        RuntimeException fail(RuntimeException e) {
            log.errorf(e, "%s %s failed in %s: %s", name, archivePath, stage, e.getMessage());
            stage = PipelineStage.FAILED;
            return e;
        }
    }
}
