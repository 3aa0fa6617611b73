package com.lanhub.collector.intake.model;

public record FieldMergeOverride(MergeMode mergeMode, String groupByField) {
}
