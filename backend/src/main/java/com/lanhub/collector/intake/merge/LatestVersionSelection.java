package com.lanhub.collector.intake.merge;

import java.nio.file.Path;
import java.util.List;

public record LatestVersionSelection(List<Path> selected, int totalFiles) {
    public LatestVersionSelection {
        selected = List.copyOf(selected);
    }

    public int excludedCount() {
        return totalFiles - selected.size();
    }
}
