package com.lanhub.collector.intake.service;

import com.lanhub.collector.config.CollectorProperties;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
public class SlugGenerator {
    // No I, O, 0 or 1.
    private static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private final SecureRandom random = new SecureRandom();
    private final CollectorProperties properties;

    public SlugGenerator(CollectorProperties properties) {
        this.properties = properties;
    }

    public String next() {
        int length = properties.getTasks().getSlugLength();
        char[] slug = new char[length];
        for (int i = 0; i < length; i++) {
            slug[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
        }
        return new String(slug);
    }
}
