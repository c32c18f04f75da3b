package com.libragraph.vpk.formats.container;

import com.libragraph.vpk.util.VpkException;

/**
 * Thrown when a header string does not fit its fixed width once UTF-8 encoded.
 * Values are never truncated.
 */
public class HeaderFieldTooLongException extends VpkException {

    private final String field;
    private final int width;
    private final int actualLength;

    public HeaderFieldTooLongException(String field, int width, int actualLength) {
        super("Header field '" + field + "' is " + actualLength
                + " bytes, maximum is " + width);
        this.field = field;
        this.width = width;
        this.actualLength = actualLength;
    }

    public String field() {
        return field;
    }

    public int width() {
        return width;
    }

    public int actualLength() {
        return actualLength;
    }
}
