package com.lanhub.collector.intake.merge;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CsvTabularRowStoreTest {

    private final CsvTabularRowStore store = new CsvTabularRowStore();

    @TempDir
    Path folder;

    @Test
    void blankLinesCountTowardsTheHeaderRow() throws IOException {
        Path file = folder.resolve("signup.csv");
        Files.writeString(file, "报名表\n\n姓名,金额\n张三,1\n\n李四,2\n", StandardCharsets.UTF_8);

        TabularSheet sheet = store.readSheet(file, 2);

        assertEquals(List.of("姓名", "金额"), sheet.headers());
        assertThat(sheet.rows()).containsExactly(List.of("张三", "1"), List.of("李四", "2"));
        assertEquals(List.of("姓名", "金额"), store.readHeaders(file, 2));
    }

    @Test
    void leadingBlankLineIsTheFirstRow() throws IOException {
        Path file = folder.resolve("budget.csv");
        Files.writeString(file, "\n姓名,金额\n张三,1\n", StandardCharsets.UTF_8);

        assertEquals(List.of(), store.readHeaders(file, 0));
        assertEquals(List.of("姓名", "金额"), store.readHeaders(file, 1));
    }

    @Test
    void byteOrderMarkIsStrippedFromTheFirstCell() throws IOException {
        Path file = folder.resolve("bom.csv");
        Files.writeString(file, "\uFEFF姓名,金额\n张三,1\n", StandardCharsets.UTF_8);

        assertEquals(List.of("姓名", "金额"), store.readSheet(file, 0).headers());
    }
}
