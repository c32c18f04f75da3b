package com.libragraph.vpk.core.archive;

import com.libragraph.vpk.core.crypto.KdfParameters;
import com.libragraph.vpk.formats.api.UnsupportedCodecException;
import com.libragraph.vpk.types.CompressionMode;
import com.libragraph.vpk.types.EncryptionMode;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PackageSettingsTest {

    private static Config config(Map<String, String> values) {
        return new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(values, "test", 500))
                .build();
    }

    @Test
    void defaultsShouldMatchWriterConstants() {
        PackageSettings d = PackageSettings.defaults();

        assertThat(d.encryption()).isEqualTo(EncryptionMode.AES_GCM);
        assertThat(d.compression()).isEqualTo(CompressionMode.ZSTD);
        assertThat(d.formatVersion()).isEqualTo(3);
        assertThat(d.description()).isEqualTo("Encrypted data package");
        assertThat(d.author()).isEqualTo("Libragraph");
        assertThat(d.copyright()).isEqualTo("Libragraph 2026");
        assertThat(d.defaultName()).isEqualTo("archive");
        assertThat(d.readThreads()).isEqualTo(1);
        assertThat(d.strictVersion()).isFalse();
        assertThat(d.kdf()).isEqualTo(new KdfParameters(32, 2, 10000, 8));
    }

    @Test
    void emptyConfigShouldYieldDefaults() {
        assertThat(PackageSettings.from(config(Map.of()))).isEqualTo(PackageSettings.defaults());
    }

    @Test
    void bundledPropertiesShouldMatchDefaults() {
        assertThat(PackageSettings.load()).isEqualTo(PackageSettings.defaults());
    }

    @Test
    void shouldReadOverrides() {
        PackageSettings settings = PackageSettings.from(config(Map.of(
                "vpk.package.encryption", "AES-CBC",
                "vpk.package.compression", "lz4",
                "vpk.package.format-version", "4",
                "vpk.package.author", "Ops",
                "vpk.package.read-threads", "3",
                "vpk.package.strict-version", "true",
                "vpk.kdf.memory-cost-kib", "2048",
                "vpk.kdf.parallelism", "2")));

        assertThat(settings.encryption()).isEqualTo(EncryptionMode.AES_CBC);
        assertThat(settings.compression()).isEqualTo(CompressionMode.LZ4);
        assertThat(settings.formatVersion()).isEqualTo(4);
        assertThat(settings.author()).isEqualTo("Ops");
        assertThat(settings.copyright()).isEqualTo("Libragraph 2026");
        assertThat(settings.readThreads()).isEqualTo(3);
        assertThat(settings.strictVersion()).isTrue();
        assertThat(settings.kdf()).isEqualTo(new KdfParameters(32, 2, 2048, 2));
    }

    @Test
    void unknownCompressionShouldBeUnsupportedCodec() {
        Config config = config(Map.of("vpk.package.compression", "brotli"));

        assertThatThrownBy(() -> PackageSettings.from(config))
                .isInstanceOf(UnsupportedCodecException.class)
                .hasMessageContaining("brotli");
    }

    @Test
    void unknownEncryptionShouldBeRejected() {
        Config config = config(Map.of("vpk.package.encryption", "DES"));

        assertThatIllegalArgumentException().isThrownBy(() -> PackageSettings.from(config));
    }

    @Test
    void readThreadsMustBePositive() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> PackageSettings.defaults().withReadThreads(0));
    }
}
