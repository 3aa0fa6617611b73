package com.lanhub.collector.intake.merge;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface TabularRowStore {

    /**
     * Header row at {@code headerRowIndex}, blank cells dropped. Empty when the file has fewer rows.
     */
    List<String> readHeaders(Path file, int headerRowIndex) throws IOException;

    TabularSheet readSheet(Path file, int headerRowIndex) throws IOException;

    void writeRows(Path file, List<String> headers, List<List<String>> rows) throws IOException;
}
