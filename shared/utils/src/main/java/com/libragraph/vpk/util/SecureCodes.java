package com.libragraph.vpk.util;

import java.security.SecureRandom;
import java.util.EnumSet;
import java.util.Set;

/**
 * Random codes for standalone key material (secrets, salts, tokens)
 * that are not tied to an archive.
 */
public final class SecureCodes {

    public enum Charset {
        LOWERCASE("abcdefghijklmnopqrstuvwxyz"),
        UPPERCASE("ABCDEFGHIJKLMNOPQRSTUVWXYZ"),
        DIGITS("0123456789"),
        SYMBOLS("!#$%&()*+,-./:;<=>?@[]^_{|}~");

        private final String alphabet;

        Charset(String alphabet) {
            this.alphabet = alphabet;
        }

        public String alphabet() {
            return alphabet;
        }
    }

    private static final SecureRandom RANDOM = new SecureRandom();

    private SecureCodes() {
    }

    /** Alphanumeric code (lowercase, uppercase, digits). */
    public static String generate(int length) {
        return generate(length, EnumSet.of(Charset.LOWERCASE, Charset.UPPERCASE, Charset.DIGITS));
    }

    /**
     * Generates a code of {@code length} characters drawn uniformly from the union
     * of the given charsets.
     *
     * @throws IllegalArgumentException if length is not positive or no charset is given
     */
    public static String generate(int length, Set<Charset> charsets) {
        if (length <= 0) {
            throw new IllegalArgumentException("Code length must be > 0, got: " + length);
        }
        if (charsets == null || charsets.isEmpty()) {
            throw new IllegalArgumentException("At least one charset is required");
        }

        StringBuilder pool = new StringBuilder();
        for (Charset c : EnumSet.copyOf(charsets)) {
            pool.append(c.alphabet());
        }

        char[] code = new char[length];
        for (int i = 0; i < length; i++) {
            code[i] = pool.charAt(RANDOM.nextInt(pool.length()));
        }
        return new String(code);
    }
}
