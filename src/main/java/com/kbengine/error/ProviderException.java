package com.kbengine.error;

public class ProviderException extends KnowledgeEngineException {
    private final String providerName;

    public ProviderException(String providerName, String message, boolean retryable) {
        this(providerName, message, retryable, null);
    }

    public ProviderException(String providerName, String message, boolean retryable, Throwable cause) {
        super(ErrorKind.PROVIDER, "Provider error (" + providerName + "): " + message, retryable, cause);
        this.providerName = providerName;
    }

    public String providerName() {
        return providerName;
    }
}
