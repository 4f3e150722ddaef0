package com.ledgerlens.categorizer.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum PatternType {
    KEYWORD("keyword"),
    VENDOR("vendor"),
    REGEX("regex"),
    EXACT("exact"),
    CONTAINS("contains");

    private final String value;

    PatternType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<PatternType> fromStorage(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst();
    }

    public static PatternType parse(String raw) {
        return fromStorage(raw)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported pattern type: " + raw));
    }
}
