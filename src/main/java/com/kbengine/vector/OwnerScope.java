package com.kbengine.vector;

import com.kbengine.error.ValidationException;

public record OwnerScope(SourceKind kind, String id) {
    private static final OwnerScope SYSTEM = new OwnerScope(SourceKind.SYSTEM, null);

    public OwnerScope {
        if (kind == null) {
            throw new ValidationException("owner scope kind is required");
        }
        if (kind != SourceKind.SYSTEM && (id == null || id.isBlank())) {
            throw new ValidationException(kind.label() + " owner scope requires an id");
        }
        if (kind == SourceKind.SYSTEM) {
            id = null;
        }
    }

    public static OwnerScope system() {
        return SYSTEM;
    }

    public static OwnerScope tenant(String tenantId) {
        return new OwnerScope(SourceKind.TENANT, tenantId);
    }

    public static OwnerScope user(String userId) {
        return new OwnerScope(SourceKind.USER, userId);
    }

    public static OwnerScope parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("owner scope is required");
        }
        String trimmed = value.trim();
        if ("system".equals(trimmed)) {
            return SYSTEM;
        }
        int colon = trimmed.indexOf(':');
        if (colon > 0) {
            String prefix = trimmed.substring(0, colon);
            String id = trimmed.substring(colon + 1);
            if ("tenant".equals(prefix)) {
                return tenant(id);
            }
            if ("user".equals(prefix)) {
                return user(id);
            }
        }
        throw new ValidationException("invalid owner scope: " + value);
    }

    @Override
    public String toString() {
        return kind == SourceKind.SYSTEM ? "system" : kind.label() + ":" + id;
    }
}
