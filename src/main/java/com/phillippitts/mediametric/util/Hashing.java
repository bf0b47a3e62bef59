package com.phillippitts.mediametric.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable content-independent hashing of canonical identity strings.
 */
public final class Hashing {

    private Hashing() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the lowercase hex SHA-1 digest of the UTF-8 bytes of {@code value}.
     *
     * @param value string to hash
     * @return 40-character hex digest
     */
    public static String sha1Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
