package com.lanhub.collector.intake.storage;

import org.springframework.core.io.InputStreamSource;

public record IncomingFile(String originalFilename, long size, InputStreamSource content) {
}
