package com.libragraph.vpk.formats.container;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class HeaderCodecTest {

    @TempDir
    Path dir;

    private static ArchiveHeader header(String name) {
        return new ArchiveHeader(name, "Encrypted data package", 2203923L,
                "Libragraph", "Valky ⓒ 2023", 1696440810L,
                "AES-GCM", 32, 3, "zstd");
    }

    @Test
    void shouldEncodeToFixedSize() {
        assertThat(HeaderCodec.encode(header("example"))).hasSize(HeaderCodec.HEADER_SIZE);
    }

    @Test
    void shouldRoundTrip() {
        ArchiveHeader original = header("example");

        assertThat(HeaderCodec.decode(HeaderCodec.encode(original))).isEqualTo(original);
    }

    @Test
    void shouldPlaceFieldsAtAlignedOffsets() {
        byte[] bytes = HeaderCodec.encode(header("example"));
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);

        assertThat(new String(bytes, 0, 7, StandardCharsets.US_ASCII)).isEqualTo("example");
        assertThat(buf.getInt(40)).isEqualTo(2203923);
        assertThat(new String(bytes, 44, 10, StandardCharsets.US_ASCII)).isEqualTo("Libragraph");
        assertThat(buf.getInt(80)).isEqualTo(1696440810);
        assertThat(new String(bytes, 84, 7, StandardCharsets.US_ASCII)).isEqualTo("AES-GCM");
        assertThat(buf.getInt(92)).isEqualTo(32);
        assertThat(buf.getInt(96)).isEqualTo(3);
        assertThat(new String(bytes, 100, 4, StandardCharsets.US_ASCII)).isEqualTo("zstd");
    }

    @Test
    void paddingShouldBeZero() {
        byte[] bytes = HeaderCodec.encode(header("example"));

        assertThat(Arrays.copyOfRange(bytes, 38, 40)).containsOnly(0);
        assertThat(Arrays.copyOfRange(bytes, 77, 80)).containsOnly(0);
        assertThat(bytes[91]).isZero();
    }

    @Test
    void shouldAcceptNameAtExactWidth() {
        ArchiveHeader original = header("abcdefghijklmnop");

        ArchiveHeader decoded = HeaderCodec.decode(HeaderCodec.encode(original));
        assertThat(decoded.name()).isEqualTo("abcdefghijklmnop");
    }

    @Test
    void shouldRejectNameOverWidth() {
        assertThatThrownBy(() -> HeaderCodec.encode(header("abcdefghijklmnopq")))
                .isInstanceOf(HeaderFieldTooLongException.class)
                .satisfies(e -> {
                    HeaderFieldTooLongException ex = (HeaderFieldTooLongException) e;
                    assertThat(ex.field()).isEqualTo("name");
                    assertThat(ex.width()).isEqualTo(16);
                    assertThat(ex.actualLength()).isEqualTo(17);
                });
    }

    @Test
    void shouldMeasureWidthInEncodedBytes() {
        // 6 characters, 18 bytes in UTF-8
        String wide = "ⓒ".repeat(6);

        assertThatThrownBy(() -> HeaderCodec.encode(header(wide)))
                .isInstanceOf(HeaderFieldTooLongException.class)
                .hasMessageContaining("18 bytes");
    }

    @Test
    void shouldRejectOverlongCompressionName() {
        ArchiveHeader h = new ArchiveHeader("n", "d", 0, "a", "c", 0, "AES-GCM", 32, 3, "brotli");

        assertThatThrownBy(() -> HeaderCodec.encode(h))
                .isInstanceOf(HeaderFieldTooLongException.class)
                .hasMessageContaining("compression");
    }

    @Test
    void shouldRejectEmbeddedNul() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> HeaderCodec.encode(header("bad\0name")));
    }

    @Test
    void shouldCarryFullUnsignedRange() {
        ArchiveHeader h = new ArchiveHeader("n", "d", 0xFFFFFFFFL, "a", "c", 0xFFFFFFFFL,
                "AES-CTR", 16, 0, "none");

        assertThat(HeaderCodec.decode(HeaderCodec.encode(h))).isEqualTo(h);
    }

    @Test
    void shouldRejectValuesOutsideU32() {
        ArchiveHeader h = new ArchiveHeader("n", "d", 1L << 32, "a", "c", 0, "AES-GCM", 32, 3, "zstd");

        assertThatIllegalArgumentException()
                .isThrownBy(() -> HeaderCodec.encode(h))
                .withMessageContaining("payload_size");
    }

    @Test
    void shouldRejectShortBuffer() {
        assertThatThrownBy(() -> HeaderCodec.decode(new byte[HeaderCodec.HEADER_SIZE - 1]))
                .isInstanceOfSatisfying(ArchiveIoException.class, e -> assertThat(e.path()).isNull())
                .hasMessageContaining("104");
    }

    @Test
    void probeShouldReadOnlyTheHeader() throws Exception {
        ArchiveHeader original = header("probe");
        byte[] bytes = HeaderCodec.encode(original);
        Path file = dir.resolve("probe.vpk");
        // payload that is not valid anything
        Files.write(file, concat(bytes, new byte[]{(byte) 0xde, (byte) 0xad}));

        assertThat(HeaderCodec.probe(file)).isEqualTo(original);
    }

    @Test
    void probeShouldRejectTruncatedFile() throws Exception {
        Path file = Files.write(dir.resolve("short.vpk"), new byte[10]);

        assertThatThrownBy(() -> HeaderCodec.probe(file))
                .isInstanceOf(ArchiveIoException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void probeShouldWrapMissingFile() {
        Path missing = dir.resolve("missing.vpk");

        assertThatThrownBy(() -> HeaderCodec.probe(missing))
                .isInstanceOf(ArchiveIoException.class)
                .satisfies(e -> assertThat(((ArchiveIoException) e).path()).isEqualTo(missing))
                .hasCauseInstanceOf(java.io.IOException.class);
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
