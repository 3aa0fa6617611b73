package com.lanhub.collector.intake.storage;

import java.nio.file.Path;

public record StoredArtifact(Path path, int version) {
    public String fileName() {
        return path.getFileName().toString();
    }
}
