package com.lanhub.collector.intake.merge;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV row store. Blank lines are kept as records so the header row index counts lines the way a
 * spreadsheet counts rows; blank data rows are dropped when a sheet is read.
 */
@Component
public class CsvTabularRowStore implements TabularRowStore {
    private static final String BOM = "\uFEFF";

    @Override
    public List<String> readHeaders(Path file, int headerRowIndex) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            int index = 0;
            for (CSVRecord record : parser) {
                if (index++ == headerRowIndex) {
                    List<String> headers = new ArrayList<>();
                    for (String cell : cells(record)) {
                        if (!cell.isBlank()) {
                            headers.add(cell.trim());
                        }
                    }
                    return headers;
                }
            }
        }
        return List.of();
    }

    @Override
    public TabularSheet readSheet(Path file, int headerRowIndex) throws IOException {
        List<String> headers = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        List<List<String>> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            int index = 0;
            for (CSVRecord record : parser) {
                List<String> cells = cells(record);
                if (index < headerRowIndex) {
                    index++;
                    continue;
                }
                if (index++ == headerRowIndex) {
                    for (int i = 0; i < cells.size(); i++) {
                        if (!cells.get(i).isBlank()) {
                            headers.add(cells.get(i).trim());
                            positions.add(i);
                        }
                    }
                    continue;
                }
                if (cells.stream().allMatch(String::isBlank)) {
                    continue;
                }
                List<String> row = new ArrayList<>(positions.size());
                for (int position : positions) {
                    row.add(position < cells.size() ? cells.get(position) : "");
                }
                rows.add(row);
            }
        }
        return new TabularSheet(headers, rows);
    }

    @Override
    public void writeRows(Path file, List<String> headers, List<List<String>> rows) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(headers.toArray(new String[0]))
            .build();
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(false)
            .build();
        return format.parse(reader);
    }

    private List<String> cells(CSVRecord record) {
        List<String> cells = new ArrayList<>(record.size());
        for (int i = 0; i < record.size(); i++) {
            String value = record.get(i);
            if (record.getRecordNumber() == 1 && i == 0 && value.startsWith(BOM)) {
                value = value.substring(1);
            }
            cells.add(value == null ? "" : value);
        }
        return cells;
    }
}
