package com.lanhub.collector.intake.storage;

public class ArtifactStorageException extends RuntimeException {
    private final String path;

    public ArtifactStorageException(String path, Throwable cause) {
        super("Failed to write " + path, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
