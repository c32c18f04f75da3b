package com.libragraph.vpk.core.archive;

import com.libragraph.vpk.core.crypto.KdfParameters;
import com.libragraph.vpk.formats.api.UnsupportedCodecException;
import com.libragraph.vpk.types.CompressionMode;
import com.libragraph.vpk.types.EncryptionMode;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.util.Objects;

/**
 * Writer constants and mode selection for a {@link PackagePipeline}.
 *
 * <p>{@link #from(Config)} reads the {@code vpk.package.*} and {@code vpk.kdf.*}
 * keys; anything absent falls back to {@link #defaults()}.
 */
public record PackageSettings(
        EncryptionMode encryption,
        CompressionMode compression,
        long formatVersion,
        String description,
        String author,
        String copyright,
        String defaultName,
        int readThreads,
        boolean strictVersion,
        KdfParameters kdf) {

    public static final long FORMAT_VERSION = 3;

    public PackageSettings {
        Objects.requireNonNull(encryption, "encryption cannot be null");
        Objects.requireNonNull(compression, "compression cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(author, "author cannot be null");
        Objects.requireNonNull(copyright, "copyright cannot be null");
        Objects.requireNonNull(defaultName, "defaultName cannot be null");
        Objects.requireNonNull(kdf, "kdf cannot be null");
        if (readThreads < 1) {
            throw new IllegalArgumentException("readThreads must be at least 1, got: " + readThreads);
        }
    }

    public static PackageSettings defaults() {
        return new PackageSettings(
                EncryptionMode.AES_GCM,
                CompressionMode.ZSTD,
                FORMAT_VERSION,
                "Encrypted data package",
                "Libragraph",
                "Libragraph 2026",
                "archive",
                1,
                false,
                KdfParameters.DEFAULTS);
    }

    /** Settings from the global MicroProfile config. */
    public static PackageSettings load() {
        return from(ConfigProvider.getConfig());
    }

    /**
     * @throws IllegalArgumentException  for an unknown encryption label
     * @throws UnsupportedCodecException for an unknown compression label
     */
    public static PackageSettings from(Config config) {
        PackageSettings d = defaults();
        KdfParameters kdf = new KdfParameters(
                config.getOptionalValue("vpk.kdf.key-length", Integer.class).orElse(d.kdf().keyLength()),
                config.getOptionalValue("vpk.kdf.time-cost", Integer.class).orElse(d.kdf().timeCost()),
                config.getOptionalValue("vpk.kdf.memory-cost-kib", Integer.class).orElse(d.kdf().memoryCostKib()),
                config.getOptionalValue("vpk.kdf.parallelism", Integer.class).orElse(d.kdf().parallelism()));
        return new PackageSettings(
                config.getOptionalValue("vpk.package.encryption", String.class)
                        .map(EncryptionMode::fromLabel)
                        .orElse(d.encryption()),
                config.getOptionalValue("vpk.package.compression", String.class)
                        .map(PackageSettings::compressionMode)
                        .orElse(d.compression()),
                config.getOptionalValue("vpk.package.format-version", Long.class).orElse(d.formatVersion()),
                config.getOptionalValue("vpk.package.description", String.class).orElse(d.description()),
                config.getOptionalValue("vpk.package.author", String.class).orElse(d.author()),
                config.getOptionalValue("vpk.package.copyright", String.class).orElse(d.copyright()),
                config.getOptionalValue("vpk.package.default-name", String.class).orElse(d.defaultName()),
                config.getOptionalValue("vpk.package.read-threads", Integer.class).orElse(d.readThreads()),
                config.getOptionalValue("vpk.package.strict-version", Boolean.class).orElse(d.strictVersion()),
                kdf);
    }

    private static CompressionMode compressionMode(String label) {
        return CompressionMode.findByLabel(label)
                .orElseThrow(() -> new UnsupportedCodecException(label));
    }

    public PackageSettings withEncryption(EncryptionMode mode) {
        return new PackageSettings(mode, compression, formatVersion, description, author, copyright,
                defaultName, readThreads, strictVersion, kdf);
    }

    public PackageSettings withCompression(CompressionMode mode) {
        return new PackageSettings(encryption, mode, formatVersion, description, author, copyright,
                defaultName, readThreads, strictVersion, kdf);
    }

    public PackageSettings withFormatVersion(long version) {
        return new PackageSettings(encryption, compression, version, description, author, copyright,
                defaultName, readThreads, strictVersion, kdf);
    }

    public PackageSettings withReadThreads(int threads) {
        return new PackageSettings(encryption, compression, formatVersion, description, author, copyright,
                defaultName, threads, strictVersion, kdf);
    }

    public PackageSettings withStrictVersion(boolean strict) {
        return new PackageSettings(encryption, compression, formatVersion, description, author, copyright,
                defaultName, readThreads, strict, kdf);
    }

    public PackageSettings withKdf(KdfParameters parameters) {
        return new PackageSettings(encryption, compression, formatVersion, description, author, copyright,
                defaultName, readThreads, strictVersion, parameters);
    }
}
