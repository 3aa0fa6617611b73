package com.lanhub.collector.intake.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ColumnType {
    NUMBER("数字"),
    TEXT("文本"),
    BOOLEAN("双选框(是/否)");

    private final String label;

    ColumnType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @JsonValue
    public String jsonName() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ColumnType fromJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        String value = raw.trim();
        for (ColumnType type : values()) {
            if (type.name().equalsIgnoreCase(value) || type.label.equals(value)) {
                return type;
            }
        }
        if (value.equalsIgnoreCase("bool") || value.startsWith("双选框")) {
            return BOOLEAN;
        }
        return TEXT;
    }
}
