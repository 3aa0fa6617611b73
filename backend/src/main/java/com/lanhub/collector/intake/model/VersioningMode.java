package com.lanhub.collector.intake.model;

public enum VersioningMode {
    OVERWRITE,
    AUTO_VERSION
}
