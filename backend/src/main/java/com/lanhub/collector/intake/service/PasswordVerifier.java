package com.lanhub.collector.intake.service;

import com.lanhub.collector.intake.util.HashUtils;
import org.springframework.stereotype.Component;

@Component
public class PasswordVerifier {

    public String hash(String rawPassword) {
        if (rawPassword == null || rawPassword.isBlank()) {
            return null;
        }
        return HashUtils.sha256Hex(rawPassword);
    }

    public boolean verify(String rawPassword, String passwordHash) {
        if (passwordHash == null || passwordHash.isBlank()) {
            return true;
        }
        return rawPassword != null && HashUtils.matchesSha256Hex(rawPassword, passwordHash);
    }
}
