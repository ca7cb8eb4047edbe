package com.kbengine.error;

public class PermissionException extends KnowledgeEngineException {
    public PermissionException(String message) {
        super(ErrorKind.PERMISSION, message, false, null);
    }
}
