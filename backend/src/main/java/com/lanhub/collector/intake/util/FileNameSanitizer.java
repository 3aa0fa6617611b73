package com.lanhub.collector.intake.util;

import java.util.regex.Pattern;

public final class FileNameSanitizer {
    public static final String UNKNOWN = "Unknown";

    private static final int MAX_SEGMENT_LENGTH = 100;
    private static final Pattern NAME_DISALLOWED = Pattern.compile("[^\\u4e00-\\u9fa5a-zA-Z0-9\\-_]");
    private static final char SEGMENT_DELIMITER = '-';
    private static final Pattern PATH_DISALLOWED = Pattern.compile("[^\\u4e00-\\u9fa5a-zA-Z0-9\\-_.]");

    private FileNameSanitizer() {
    }

    /**
     * Reduces a person or department name to a file-name segment. Characters outside
     * CJK, ASCII letters, digits, '-' and '_' are removed, and '-' becomes '_' because it
     * delimits the segments of a versioned submission name.
     */
    public static String nameSegment(String input) {
        if (input == null || input.isBlank()) {
            return UNKNOWN;
        }
        String cleaned = NAME_DISALLOWED.matcher(input.trim()).replaceAll("")
            .replace(SEGMENT_DELIMITER, '_');
        return cleaned.isEmpty() ? UNKNOWN : cleaned;
    }

    public static String pathSegment(String input) {
        if (input == null || input.isBlank()) {
            return UNKNOWN;
        }
        String cleaned = input.trim()
            .replace("..", "")
            .replace("/", "")
            .replace("\\", "");
        cleaned = PATH_DISALLOWED.matcher(cleaned).replaceAll("_");
        if (cleaned.length() > MAX_SEGMENT_LENGTH) {
            cleaned = cleaned.substring(0, MAX_SEGMENT_LENGTH);
        }
        return cleaned.isEmpty() ? UNKNOWN : cleaned;
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        String base = baseName(fileName);
        int dot = base.lastIndexOf('.');
        return dot <= 0 ? "" : base.substring(dot);
    }

    public static String stripExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        String base = baseName(fileName);
        int dot = base.lastIndexOf('.');
        return dot <= 0 ? base : base.substring(0, dot);
    }

    private static String baseName(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        return slash >= 0 ? fileName.substring(slash + 1) : fileName;
    }
}
