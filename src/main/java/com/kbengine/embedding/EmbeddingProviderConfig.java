package com.kbengine.embedding;

import java.util.Locale;

import com.kbengine.error.ValidationException;

public record EmbeddingProviderConfig(ProviderType providerType, String modelId, int dimensionality, String deviceCapability) {

    public EmbeddingProviderConfig {
        if (providerType == null) {
            throw new ValidationException("embedding providerType is required");
        }
        if (modelId == null || modelId.isBlank()) {
            throw new ValidationException("embedding modelId is required");
        }
        if (dimensionality <= 0) {
            throw new ValidationException("embedding dimensionality must be > 0, got " + dimensionality);
        }
        deviceCapability = deviceCapability == null || deviceCapability.isBlank() ? "auto" : deviceCapability;
    }

    public enum ProviderType {
        LOCAL,
        REMOTE;

        public static ProviderType parse(String value) {
            if (value == null || value.isBlank()) {
                throw new ValidationException("no embedding provider configured");
            }
            try {
                return ProviderType.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("unknown embedding provider type: " + value);
            }
        }
    }
}
