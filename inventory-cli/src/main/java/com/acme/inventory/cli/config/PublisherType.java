package com.acme.inventory.cli.config;

import java.util.Locale;

public enum PublisherType {
    SNS,
    KAFKA,
    NONE;

    public static PublisherType parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown publisher '" + value + "', expected sns, kafka or none", e);
        }
    }
}
