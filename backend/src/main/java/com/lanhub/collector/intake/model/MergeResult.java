package com.lanhub.collector.intake.model;

public record MergeResult(
    int totalFiles,
    int filteredFiles,
    int mergedFiles,
    int totalRecords,
    int deduplicatedRecords,
    int duplicatedCount,
    String outputPath,
    boolean success,
    String errorMessage
) {
    public static MergeResult failed(String errorMessage) {
        return new MergeResult(0, 0, 0, 0, 0, 0, null, false, errorMessage);
    }

    public static MergeResult failed(int totalFiles, String errorMessage) {
        return new MergeResult(totalFiles, 0, 0, 0, 0, 0, null, false, errorMessage);
    }

    public String summary() {
        if (!success) {
            return "Merge failed: " + errorMessage;
        }
        StringBuilder out = new StringBuilder("Merge complete. files=")
            .append(totalFiles)
            .append(", older versions skipped=")
            .append(filteredFiles)
            .append(", merged=")
            .append(mergedFiles);
        if (duplicatedCount > 0) {
            out.append(", records=").append(totalRecords)
                .append(", kept=").append(deduplicatedRecords)
                .append(", duplicates removed=").append(duplicatedCount);
        } else {
            out.append(", records=").append(deduplicatedRecords);
        }
        return out.toString();
    }
}
