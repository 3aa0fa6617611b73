package com.lanhub.collector.intake.merge;

import com.lanhub.collector.intake.model.ColumnDefinition;

import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface FieldAggregator {
    List<StatisticsRow> aggregate(ColumnDefinition column, List<Map<String, FieldValue>> records);
}
