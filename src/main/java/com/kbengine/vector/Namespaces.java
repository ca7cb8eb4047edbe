package com.kbengine.vector;

import java.util.Optional;

import com.kbengine.error.ValidationException;

public class Namespaces {
    private final String prefix;

    public Namespaces(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new ValidationException("namespace prefix is required");
        }
        this.prefix = prefix.trim();
    }

    public String system() {
        return prefix + "-system-kb";
    }

    public String tenant(String tenantId) {
        return prefix + "-tenant-" + tenantId;
    }

    public String user(String userId) {
        return prefix + "-user-" + userId;
    }

    public String forOwner(OwnerScope owner) {
        return switch (owner.kind()) {
            case SYSTEM -> system();
            case TENANT -> tenant(owner.id());
            case USER -> user(owner.id());
        };
    }

    public Optional<SourceKind> kindOf(String namespace) {
        if (namespace == null) {
            return Optional.empty();
        }
        if (namespace.equals(system())) {
            return Optional.of(SourceKind.SYSTEM);
        }
        if (namespace.startsWith(prefix + "-tenant-")) {
            return Optional.of(SourceKind.TENANT);
        }
        if (namespace.startsWith(prefix + "-user-")) {
            return Optional.of(SourceKind.USER);
        }
        return Optional.empty();
    }

    public String prefix() {
        return prefix;
    }
}
