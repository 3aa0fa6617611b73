package com.lanhub.collector.intake.merge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lanhub.collector.intake.model.TableSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class SchemaReader {
    private final ObjectMapper objectMapper;

    public SchemaReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TableSchema read(Path schemaFile) throws IOException {
        try (InputStream in = Files.newInputStream(schemaFile)) {
            return objectMapper.readValue(in, TableSchema.class);
        }
    }
}
