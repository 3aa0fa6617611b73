package com.lanhub.collector.intake.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public final class HashUtils {
    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        byte[] hash = sha256(value == null ? "" : value);
        StringBuilder out = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            out.append(String.format("%02x", b));
        }
        return out.toString();
    }

    public static boolean matchesSha256Hex(String value, String expectedHex) {
        if (expectedHex == null || expectedHex.isBlank()) {
            return false;
        }
        byte[] actual = sha256Hex(value).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = expectedHex.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(actual, expected);
    }

    private static byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
