package com.lanhub.collector.intake.merge;

import java.util.List;

public record StatisticsRow(String fieldName, String fieldType, int totalSubmissions, String result, String detail) {
    public static final List<String> HEADERS = List.of("字段名称", "字段类型", "总提交数", "统计结果", "详细信息");

    public List<String> toCells() {
        return List.of(fieldName, fieldType, Integer.toString(totalSubmissions), result, detail == null ? "" : detail);
    }
}
