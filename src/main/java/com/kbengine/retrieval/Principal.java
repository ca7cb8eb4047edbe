package com.kbengine.retrieval;

import com.kbengine.error.ValidationException;

public record Principal(String userId, String tenantId) {
    public Principal {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("principal requires a user id");
        }
        if (tenantId != null && tenantId.isBlank()) {
            tenantId = null;
        }
    }

    public static Principal user(String userId) {
        return new Principal(userId, null);
    }
}
