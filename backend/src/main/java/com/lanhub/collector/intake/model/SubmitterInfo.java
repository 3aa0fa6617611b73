package com.lanhub.collector.intake.model;

public record SubmitterInfo(String name, String contact, String department, String clientIp) {
}
