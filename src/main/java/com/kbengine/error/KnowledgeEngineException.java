package com.kbengine.error;

public abstract class KnowledgeEngineException extends RuntimeException {
    private final ErrorKind kind;
    private final boolean retryable;

    protected KnowledgeEngineException(ErrorKind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean retryable() {
        return retryable;
    }
}
