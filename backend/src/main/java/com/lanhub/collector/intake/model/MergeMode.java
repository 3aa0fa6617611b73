package com.lanhub.collector.intake.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum MergeMode {
    ACCUMULATE,
    GROUP_BY;

    @JsonCreator
    public static MergeMode fromJson(Object raw) {
        if (raw == null) {
            return ACCUMULATE;
        }
        if (raw instanceof Number number) {
            return number.intValue() == 1 ? GROUP_BY : ACCUMULATE;
        }
        String value = raw.toString().trim().replace("_", "");
        if (value.equals("1") || value.equalsIgnoreCase("groupby")) {
            return GROUP_BY;
        }
        return ACCUMULATE;
    }
}
