package com.kbengine.error;

public class NotFoundException extends KnowledgeEngineException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message, false, null);
    }
}
