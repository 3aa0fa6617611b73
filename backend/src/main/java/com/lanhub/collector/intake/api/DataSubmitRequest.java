package com.lanhub.collector.intake.api;

import java.util.Map;

public record DataSubmitRequest(
    String name,
    String contact,
    String department,
    String password,
    Map<String, Object> data
) {
}
