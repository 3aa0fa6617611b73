package com.lanhub.collector.intake.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TableSchema(String title, List<ColumnDefinition> columns) {

    @JsonCreator
    public TableSchema(
        @JsonProperty("title") String title,
        @JsonProperty("columns") List<ColumnDefinition> columns
    ) {
        this.title = title == null ? "" : title;
        this.columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
