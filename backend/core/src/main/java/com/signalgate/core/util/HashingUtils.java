package com.signalgate.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashingUtils {
    private HashingUtils() {
    }

    public static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Leading {@code length} hex characters of the SHA-256 of {@code input}. Short prefixes are not
     * collision-free, so callers that use them as keys must check for an existing entry on insert.
     */
    public static String shortHash(String input, int length) {
        if (length < 1 || length > 64) {
            throw new IllegalArgumentException("length must be within [1,64]: " + length);
        }
        return sha256(input).substring(0, length);
    }
}
