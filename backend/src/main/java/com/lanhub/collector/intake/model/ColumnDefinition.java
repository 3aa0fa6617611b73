package com.lanhub.collector.intake.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnDefinition(
    String name,
    ColumnType type,
    boolean required,
    String description,
    MergeMode mergeMode,
    String groupByField
) {
    @JsonCreator
    public ColumnDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("type") ColumnType type,
        @JsonProperty("required") boolean required,
        @JsonProperty("description") String description,
        @JsonProperty("mergeMode") MergeMode mergeMode,
        @JsonProperty("groupByField") String groupByField
    ) {
        this.name = name == null ? "" : name;
        this.type = type == null ? ColumnType.TEXT : type;
        this.required = required;
        this.description = description;
        this.mergeMode = mergeMode == null ? MergeMode.ACCUMULATE : mergeMode;
        this.groupByField = groupByField;
    }

    public boolean groupsBySelf() {
        return mergeMode == MergeMode.GROUP_BY && name.equals(groupByField);
    }

    public ColumnDefinition withMerge(MergeMode newMode, String newGroupByField) {
        return new ColumnDefinition(name, type, required, description, newMode, newGroupByField);
    }
}
