package com.lanhub.collector.intake.model;

import java.util.List;
import java.util.Map;

public record TaskMergeRequest(
    String outputPath,
    Boolean removeDuplicates,
    List<String> dedupColumns,
    String separator,
    Integer headerRowIndex,
    Map<String, FieldMergeOverride> fieldOverrides
) {
}
