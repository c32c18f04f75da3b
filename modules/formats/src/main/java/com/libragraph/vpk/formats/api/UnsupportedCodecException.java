package com.libragraph.vpk.formats.api;

/**
 * Thrown when a codec name does not match any known compression mode.
 */
public class UnsupportedCodecException extends CompressionException {

    private final String codecName;

    public UnsupportedCodecException(String codecName) {
        super("Unsupported compression codec: " + codecName);
        this.codecName = codecName;
    }

    public String codecName() {
        return codecName;
    }
}
