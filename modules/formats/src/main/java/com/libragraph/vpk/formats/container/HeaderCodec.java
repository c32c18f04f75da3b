package com.libragraph.vpk.formats.container;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Binary codec for {@link ArchiveHeader}.
 *
 * <p>Layout (105 bytes, little-endian, natural 4-byte alignment for integers;
 * padding bytes are written as zero and ignored on read):
 * <pre>
 *   0  name              16
 *  16  description       22
 *  38  (pad)              2
 *  40  payload_size      u32
 *  44  author            16
 *  60  copyright         17
 *  77  (pad)              3
 *  80  timestamp         u32
 *  84  encryption         7
 *  91  (pad)              1
 *  92  key_length        u32
 *  96  format_version    u32
 * 100  compression        5
 * </pre>
 * Strings are UTF-8, zero-padded on write and stripped of trailing zeros on read.
 */
public final class HeaderCodec {

    public static final int HEADER_SIZE = 105;

    private static final long U32_MAX = 0xFFFFFFFFL;

    enum Field {
        NAME("name", 0, 16),
        DESCRIPTION("description", 16, 22),
        PAYLOAD_SIZE("payload_size", 40, 4),
        AUTHOR("author", 44, 16),
        COPYRIGHT("copyright", 60, 17),
        TIMESTAMP("timestamp", 80, 4),
        ENCRYPTION("encryption", 84, 7),
        KEY_LENGTH("key_length", 92, 4),
        FORMAT_VERSION("format_version", 96, 4),
        COMPRESSION("compression", 100, 5);

        final String label;
        final int offset;
        final int width;

        Field(String label, int offset, int width) {
            this.label = label;
            this.offset = offset;
            this.width = width;
        }
    }

    private HeaderCodec() {
    }

    /**
     * Encodes a header into its fixed-width form.
     *
     * @throws HeaderFieldTooLongException if a string exceeds its width
     * @throws IllegalArgumentException    if a string contains NUL or a number is outside u32 range
     */
    public static byte[] encode(ArchiveHeader header) {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        putString(buf, Field.NAME, header.name());
        putString(buf, Field.DESCRIPTION, header.description());
        putU32(buf, Field.PAYLOAD_SIZE, header.payloadSize());
        putString(buf, Field.AUTHOR, header.author());
        putString(buf, Field.COPYRIGHT, header.copyright());
        putU32(buf, Field.TIMESTAMP, header.timestamp());
        putString(buf, Field.ENCRYPTION, header.encryption());
        putU32(buf, Field.KEY_LENGTH, header.keyLength());
        putU32(buf, Field.FORMAT_VERSION, header.formatVersion());
        putString(buf, Field.COMPRESSION, header.compression());
        return buf.array();
    }

    /**
     * Decodes the first {@link #HEADER_SIZE} bytes of {@code data}. Extra bytes are ignored.
     *
     * @throws ArchiveIoException if {@code data} is shorter than a header
     */
    public static ArchiveHeader decode(byte[] data) {
        if (data.length < HEADER_SIZE) {
            throw new ArchiveIoException(
                    "Header needs " + HEADER_SIZE + " bytes, got: " + data.length);
        }
        ByteBuffer buf = ByteBuffer.wrap(data, 0, HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        return new ArchiveHeader(
                getString(buf, Field.NAME),
                getString(buf, Field.DESCRIPTION),
                getU32(buf, Field.PAYLOAD_SIZE),
                getString(buf, Field.AUTHOR),
                getString(buf, Field.COPYRIGHT),
                getU32(buf, Field.TIMESTAMP),
                getString(buf, Field.ENCRYPTION),
                getU32(buf, Field.KEY_LENGTH),
                getU32(buf, Field.FORMAT_VERSION),
                getString(buf, Field.COMPRESSION));
    }

    /**
     * Reads only the header of an archive file; the payload is not touched.
     *
     * @throws ArchiveIoException if the file cannot be read or is shorter than a header
     */
    public static ArchiveHeader probe(Path path) {
        byte[] prefix;
        try (InputStream in = Files.newInputStream(path)) {
            prefix = in.readNBytes(HEADER_SIZE);
        } catch (IOException e) {
            throw new ArchiveIoException(path, "Failed to read archive header", e);
        }
        if (prefix.length < HEADER_SIZE) {
            throw new ArchiveIoException(path, "Truncated archive header (" + prefix.length + " bytes)");
        }
        return decode(prefix);
    }

    private static void putString(ByteBuffer buf, Field field, String value) {
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Header field '" + field.label + "' contains NUL");
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > field.width) {
            throw new HeaderFieldTooLongException(field.label, field.width, bytes.length);
        }
        // remaining bytes of the slot stay zero
        buf.put(field.offset, bytes);
    }

    private static void putU32(ByteBuffer buf, Field field, long value) {
        if (value < 0 || value > U32_MAX) {
            throw new IllegalArgumentException(
                    "Header field '" + field.label + "' out of u32 range: " + value);
        }
        buf.putInt(field.offset, (int) value);
    }

    private static String getString(ByteBuffer buf, Field field) {
        byte[] slot = new byte[field.width];
        buf.get(field.offset, slot);
        int end = slot.length;
        while (end > 0 && slot[end - 1] == 0) {
            end--;
        }
        return new String(Arrays.copyOf(slot, end), StandardCharsets.UTF_8);
    }

    private static long getU32(ByteBuffer buf, Field field) {
        return Integer.toUnsignedLong(buf.getInt(field.offset));
    }
}
