package com.libragraph.vpk.core.archive;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.vpk.core.crypto.DecryptionException;
import com.libragraph.vpk.core.crypto.EncryptedEnvelope;
import com.libragraph.vpk.core.crypto.EncryptionException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON forms of the two structures that live inside an archive payload.
 *
 * <p>The plaintext is a tagged object {@code {"kind":"blob-set","entries":{path: base64}}};
 * any other kind is rejected. The envelope is {@code {"ciphertext":hex,"iv":hex,"tag":hex}}.
 *
 * <p>The default mapper lifts Jackson's string length limit: the ciphertext of a
 * large archive is a single hex string several times the size of its content.
 */
public class PayloadCodec {

    static final String BLOB_SET_KIND = "blob-set";

    record Payload(String kind, LinkedHashMap<String, byte[]> entries) {
    }

    private final ObjectMapper objectMapper;

    public PayloadCodec() {
        this(new ObjectMapper(JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxStringLength(Integer.MAX_VALUE)
                        .build())
                .build()));
    }

    public PayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] writeBlobSet(BlobSet blobs) {
        try {
            return objectMapper.writeValueAsBytes(new Payload(BLOB_SET_KIND, new LinkedHashMap<>(blobs.view())));
        } catch (JsonProcessingException e) {
            throw new EncryptionException("Failed to serialize blob set", e);
        }
    }

    /**
     * @throws DecryptionException if the plaintext is not a blob-set payload
     */
    public BlobSet readBlobSet(byte[] plaintext) {
        Payload payload;
        try {
            payload = objectMapper.readValue(plaintext, Payload.class);
        } catch (IOException e) {
            throw new DecryptionException("Decrypted payload is not a valid blob set", e);
        }
        if (payload == null || !BLOB_SET_KIND.equals(payload.kind())) {
            throw new DecryptionException("Unsupported payload kind: "
                    + (payload == null ? null : payload.kind()));
        }
        if (payload.entries() == null) {
            throw new DecryptionException("Blob set payload has no entries");
        }
        BlobSet blobs = new BlobSet();
        for (Map.Entry<String, byte[]> e : payload.entries().entrySet()) {
            if (e.getValue() == null) {
                throw new DecryptionException("Blob set entry has no content: " + e.getKey());
            }
            blobs.put(e.getKey(), e.getValue());
        }
        return blobs;
    }

    public byte[] writeEnvelope(EncryptedEnvelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new EncryptionException("Failed to serialize envelope", e);
        }
    }

    /**
     * @throws DecryptionException if the bytes are not an envelope
     */
    public EncryptedEnvelope readEnvelope(byte[] data) {
        try {
            EncryptedEnvelope envelope = objectMapper.readValue(data, EncryptedEnvelope.class);
            if (envelope == null) {
                throw new DecryptionException("Envelope is empty");
            }
            return envelope;
        } catch (IOException e) {
            // includes a missing ciphertext or iv rejected by the record constructor
            throw new DecryptionException("Malformed envelope", e);
        }
    }
}
