package com.libragraph.vpk.core.crypto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Output of a single encrypt call. All fields are lowercase hex so the envelope
 * can be embedded in further serialization as plain text.
 *
 * @param ciphertext encrypted payload
 * @param iv         nonce or IV drawn for this call
 * @param tag        integrity tag; {@code null} unless the mode is authenticated
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EncryptedEnvelope(String ciphertext, String iv, String tag) {
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public EncryptedEnvelope {
        Objects.requireNonNull(ciphertext, "ciphertext cannot be null");
        Objects.requireNonNull(iv, "iv cannot be null");
    }

    public static EncryptedEnvelope of(byte[] ciphertext, byte[] iv, byte[] tag) {
        return new EncryptedEnvelope(
                HEX_FORMAT.formatHex(ciphertext),
                HEX_FORMAT.formatHex(iv),
                tag == null ? null : HEX_FORMAT.formatHex(tag));
    }

    @JsonIgnore
    public boolean hasTag() {
        return tag != null;
    }

    /** @throws IllegalArgumentException if the field is not valid hex */
    public byte[] ciphertextBytes() {
        return HEX_FORMAT.parseHex(ciphertext);
    }

    /** @throws IllegalArgumentException if the field is not valid hex */
    public byte[] ivBytes() {
        return HEX_FORMAT.parseHex(iv);
    }

    /** @throws IllegalArgumentException if the field is not valid hex */
    public byte[] tagBytes() {
        return tag == null ? null : HEX_FORMAT.parseHex(tag);
    }
}
