package com.kbengine.error;

public class ServiceUnavailableException extends VectorStoreException {
    public ServiceUnavailableException(String operation, String namespace) {
        super(operation, namespace, "circuit breaker is open", null);
    }
}
