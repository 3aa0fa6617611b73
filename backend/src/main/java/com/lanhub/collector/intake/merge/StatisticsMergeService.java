package com.lanhub.collector.intake.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lanhub.collector.intake.model.ColumnDefinition;
import com.lanhub.collector.intake.model.ColumnType;
import com.lanhub.collector.intake.model.FieldMergeOverride;
import com.lanhub.collector.intake.model.MergeMode;
import com.lanhub.collector.intake.model.MergeResult;
import com.lanhub.collector.intake.model.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a folder of JSON form records into one statistics table, one or more rows per field.
 */
@Service
public class StatisticsMergeService {
    private static final Logger log = LoggerFactory.getLogger(StatisticsMergeService.class);
    private static final Set<String> RESERVED_KEYS = Set.of("title", "columns");

    private final SchemaReader schemaReader;
    private final StatisticsAggregators aggregators;
    private final TabularRowStore rowStore;
    private final OutputReplacer outputReplacer;
    private final ObjectMapper objectMapper;

    public StatisticsMergeService(
        SchemaReader schemaReader,
        StatisticsAggregators aggregators,
        TabularRowStore rowStore,
        OutputReplacer outputReplacer,
        ObjectMapper objectMapper
    ) {
        this.schemaReader = schemaReader;
        this.aggregators = aggregators;
        this.rowStore = rowStore;
        this.outputReplacer = outputReplacer;
        this.objectMapper = objectMapper;
    }

    public MergeResult mergeStatistics(
        Path schemaPath,
        Path sourceFolder,
        Path outputPath,
        Map<String, FieldMergeOverride> overrides
    ) {
        if (sourceFolder == null || !Files.isDirectory(sourceFolder)) {
            return MergeResult.failed("Source folder does not exist: " + sourceFolder);
        }
        if (schemaPath == null || !Files.isRegularFile(schemaPath)) {
            return MergeResult.failed("Schema file does not exist: " + schemaPath);
        }
        TableSchema schema;
        try {
            schema = schemaReader.read(schemaPath);
        } catch (IOException e) {
            log.warn("Unreadable schema {}: {}", schemaPath, e.getMessage());
            return MergeResult.failed("Invalid schema " + schemaPath + ": " + e.getMessage());
        }
        if (schema.columns().isEmpty()) {
            return MergeResult.failed("Schema " + schemaPath + " defines no columns");
        }

        List<Path> files;
        try {
            files = listRecordFiles(sourceFolder, schemaPath, outputPath);
        } catch (IOException e) {
            log.error("Failed to list {}", sourceFolder, e);
            return MergeResult.failed("Failed to list " + sourceFolder + ": " + e.getMessage());
        }
        if (files.isEmpty()) {
            return MergeResult.failed("No submitted records found in " + sourceFolder);
        }

        List<Map<String, FieldValue>> records = new ArrayList<>();
        for (Path file : files) {
            try {
                Map<String, FieldValue> record = readRecord(file);
                if (record != null) {
                    records.add(record);
                }
            } catch (IOException e) {
                log.warn("Failed to parse record {}: {}", file.getFileName(), e.getMessage());
            }
        }
        if (records.isEmpty()) {
            return MergeResult.failed(files.size(), "No valid records to merge in " + sourceFolder);
        }

        Set<String> fields = workingFields(schema, records);
        log.info("Analyzing {} fields over {} records: {}", fields.size(), records.size(), fields);

        Map<String, ColumnDefinition> declared = new HashMap<>();
        for (ColumnDefinition column : schema.columns()) {
            declared.putIfAbsent(column.name(), column);
        }
        Map<String, FieldMergeOverride> effectiveOverrides = overrides == null ? Map.of() : overrides;

        List<ColumnDefinition> columns = new ArrayList<>(fields.size());
        Set<String> groupingFields = new LinkedHashSet<>();
        groupingFields.add(aggregators.defaultGroupField());
        for (String field : fields) {
            ColumnDefinition column = resolveColumn(field, declared.get(field), effectiveOverrides.get(field));
            columns.add(column);
            if (column.mergeMode() == MergeMode.GROUP_BY) {
                groupingFields.add(column.groupByField());
            }
        }

        List<StatisticsRow> rows = new ArrayList<>();
        for (ColumnDefinition column : columns) {
            rows.addAll(aggregators.aggregate(column, records, groupingFields));
        }

        List<List<String>> cells = new ArrayList<>(rows.size());
        for (StatisticsRow row : rows) {
            cells.add(row.toCells());
        }
        try {
            outputReplacer.replace(outputPath, temp -> rowStore.writeRows(temp, StatisticsRow.HEADERS, cells));
        } catch (IOException | RuntimeException e) {
            return MergeResult.failed(files.size(), "Failed to write " + outputPath + ": " + e.getMessage());
        }

        log.info("Statistics merge complete: {} ({} rows)", outputPath, rows.size());
        return new MergeResult(
            files.size(),
            0,
            rows.size(),
            records.size(),
            records.size(),
            0,
            outputPath.toString(),
            true,
            null
        );
    }

    ColumnDefinition resolveColumn(String field, ColumnDefinition declared, FieldMergeOverride override) {
        ColumnDefinition column = declared != null
            ? declared
            : new ColumnDefinition(field, ColumnType.TEXT, false, null, MergeMode.ACCUMULATE, aggregators.defaultGroupField());
        if (override != null) {
            MergeMode mode = override.mergeMode() == null ? column.mergeMode() : override.mergeMode();
            String groupBy = override.groupByField() == null || override.groupByField().isBlank()
                ? column.groupByField()
                : override.groupByField().trim();
            column = column.withMerge(mode, groupBy);
        }
        if (column.mergeMode() == MergeMode.GROUP_BY
            && (column.groupByField() == null || column.groupByField().isBlank())) {
            column = column.withMerge(MergeMode.GROUP_BY, aggregators.defaultGroupField());
        }
        if (column.groupsBySelf()) {
            log.debug("Field {} is grouped by itself, accumulating instead", field);
            column = column.withMerge(MergeMode.ACCUMULATE, column.groupByField());
        }
        return column;
    }

    private Set<String> workingFields(TableSchema schema, List<Map<String, FieldValue>> records) {
        Set<String> fields = new LinkedHashSet<>();
        for (ColumnDefinition column : schema.columns()) {
            if (!column.name().isBlank()) {
                fields.add(column.name());
            }
        }
        for (Map<String, FieldValue> record : records) {
            for (String key : record.keySet()) {
                if (!key.isBlank() && !RESERVED_KEYS.contains(key.toLowerCase(Locale.ROOT))) {
                    fields.add(key);
                }
            }
        }
        return fields;
    }

    private Map<String, FieldValue> readRecord(Path file) throws IOException {
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = objectMapper.readTree(in);
        }
        if (root == null || !root.isObject()) {
            log.warn("Skipping {}: not a JSON object", file.getFileName());
            return null;
        }
        Map<String, FieldValue> record = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            record.put(entry.getKey(), FieldValue.of(entry.getValue()));
        }
        return record;
    }

    private List<Path> listRecordFiles(Path folder, Path schemaPath, Path outputPath) throws IOException {
        Path schema = schemaPath.toAbsolutePath().normalize();
        Path output = outputPath == null ? null : outputPath.toAbsolutePath().normalize();
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path file : stream) {
                Path normalized = file.toAbsolutePath().normalize();
                String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
                if (Files.isRegularFile(file)
                    && name.endsWith(".json")
                    && !normalized.equals(schema)
                    && !normalized.equals(output)) {
                    files.add(file);
                }
            }
        }
        files.sort(Comparator.naturalOrder());
        return files;
    }
}
