package com.lanhub.collector.intake.model;

public enum TaskType {
    FILE_COLLECTION,
    DATA_COLLECTION
}
