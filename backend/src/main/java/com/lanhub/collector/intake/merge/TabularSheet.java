package com.lanhub.collector.intake.merge;

import java.util.List;

/**
 * Rows read below the header row. Each row is aligned with {@link #headers()}.
 */
public record TabularSheet(List<String> headers, List<List<String>> rows) {
    public TabularSheet {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
