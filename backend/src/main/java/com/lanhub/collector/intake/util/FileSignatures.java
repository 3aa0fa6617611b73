package com.lanhub.collector.intake.util;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Leading-byte checks for uploaded files. Binary formats must start with their magic
 * number; text formats must not start with one and must not contain NUL bytes.
 */
public final class FileSignatures {
    public static final int HEAD_LENGTH = 16;

    private static final byte[] ZIP = {0x50, 0x4B, 0x03, 0x04};
    private static final byte[] OLE = {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0};
    private static final byte[] PDF = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] PNG = {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] GIF = "GIF8".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] EXE = "MZ".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] RAR = "Rar!".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] SEVEN_ZIP = {0x37, 0x7A, (byte) 0xBC, (byte) 0xAF, 0x27, 0x1C};

    private static final Map<String, byte[]> EXPECTED = Map.ofEntries(
        Map.entry(".xlsx", ZIP),
        Map.entry(".docx", ZIP),
        Map.entry(".pptx", ZIP),
        Map.entry(".zip", ZIP),
        Map.entry(".xls", OLE),
        Map.entry(".doc", OLE),
        Map.entry(".ppt", OLE),
        Map.entry(".pdf", PDF),
        Map.entry(".jpg", JPEG),
        Map.entry(".jpeg", JPEG),
        Map.entry(".png", PNG),
        Map.entry(".gif", GIF),
        Map.entry(".rar", RAR),
        Map.entry(".7z", SEVEN_ZIP)
    );

    private static final Set<String> TEXT = Set.of(".csv", ".txt", ".json", ".tsv");
    private static final List<byte[]> BINARY = List.of(ZIP, OLE, PDF, JPEG, PNG, GIF, EXE, RAR, SEVEN_ZIP);

    private FileSignatures() {
    }

    /**
     * Whether {@code head}, the first bytes of a file, fits {@code extension}. Extensions
     * without a known signature are accepted.
     */
    public static boolean matches(String extension, byte[] head) {
        String normalized = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        byte[] expected = EXPECTED.get(normalized);
        if (expected != null) {
            return startsWith(head, expected);
        }
        if (TEXT.contains(normalized)) {
            return !looksBinary(head);
        }
        return true;
    }

    static boolean looksBinary(byte[] head) {
        for (byte[] magic : BINARY) {
            if (startsWith(head, magic)) {
                return true;
            }
        }
        for (byte b : head) {
            if (b == 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean startsWith(byte[] head, byte[] magic) {
        return head.length >= magic.length && Arrays.equals(head, 0, magic.length, magic, 0, magic.length);
    }
}
