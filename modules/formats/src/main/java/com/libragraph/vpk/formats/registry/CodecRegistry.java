package com.libragraph.vpk.formats.registry;

import com.libragraph.vpk.formats.api.Codec;
import com.libragraph.vpk.formats.api.UnsupportedCodecException;
import com.libragraph.vpk.formats.codecs.Bzip2Codec;
import com.libragraph.vpk.formats.codecs.GzipCodec;
import com.libragraph.vpk.formats.codecs.Lz4Codec;
import com.libragraph.vpk.formats.codecs.LzmaCodec;
import com.libragraph.vpk.formats.codecs.PassthroughCodec;
import com.libragraph.vpk.formats.codecs.ZstdCodec;
import com.libragraph.vpk.types.CompressionMode;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Central lookup from {@link CompressionMode} to its {@link Codec}.
 * Every mode has exactly one codec; the table is checked for completeness on construction.
 */
@ApplicationScoped
public class CodecRegistry {

    private static final Logger log = Logger.getLogger(CodecRegistry.class);

    private final Map<CompressionMode, Codec> codecs = new EnumMap<>(CompressionMode.class);

    public CodecRegistry() {
        this(List.of(
                new GzipCodec(),
                new Bzip2Codec(),
                new LzmaCodec(),
                new Lz4Codec(),
                new ZstdCodec(),
                new PassthroughCodec()));
    }

    CodecRegistry(List<Codec> available) {
        for (Codec codec : available) {
            codecs.put(codec.mode(), codec);
        }
        for (CompressionMode mode : CompressionMode.values()) {
            if (!codecs.containsKey(mode)) {
                throw new IllegalStateException("No codec registered for compression mode " + mode);
            }
        }
    }

    public Codec codec(CompressionMode mode) {
        return codecs.get(mode);
    }

    /**
     * Resolves a codec by the name stored in archive headers.
     *
     * @throws UnsupportedCodecException if the name is unknown
     */
    public Codec codec(String name) {
        return CompressionMode.findByLabel(name)
                .map(codecs::get)
                .orElseThrow(() -> new UnsupportedCodecException(name));
    }

    public byte[] compress(byte[] data, CompressionMode mode) {
        byte[] out = codec(mode).encode(data);
        log.debugf("Compressed %d -> %d bytes (%s)", data.length, out.length, mode.label());
        return out;
    }

    public byte[] decompress(byte[] data, CompressionMode mode) {
        byte[] out = codec(mode).decode(data);
        log.debugf("Decompressed %d -> %d bytes (%s)", data.length, out.length, mode.label());
        return out;
    }

    public byte[] compress(byte[] data, String codecName) {
        return compress(data, codec(codecName).mode());
    }

    public byte[] decompress(byte[] data, String codecName) {
        return decompress(data, codec(codecName).mode());
    }
}
