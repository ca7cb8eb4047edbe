package com.kbengine.error;

public class ValidationException extends KnowledgeEngineException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message, false, null);
    }
}
