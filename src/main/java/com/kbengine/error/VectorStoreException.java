package com.kbengine.error;

public class VectorStoreException extends KnowledgeEngineException {
    private final String operation;
    private final String namespace;

    public VectorStoreException(String operation, String namespace, String message, Throwable cause) {
        super(ErrorKind.VECTOR_STORE, "Vector store " + operation + " failed for namespace " + namespace + ": " + message, false, cause);
        this.operation = operation;
        this.namespace = namespace;
    }

    public String operation() {
        return operation;
    }

    public String namespace() {
        return namespace;
    }
}
