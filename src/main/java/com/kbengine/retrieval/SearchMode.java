package com.kbengine.retrieval;

import java.util.Locale;

import com.kbengine.error.ValidationException;

public enum SearchMode {
    SYSTEM,
    USER,
    HYBRID;

    public static SearchMode parse(String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown search mode: " + value);
        }
    }
}
