package com.kbengine.ingest;

@FunctionalInterface
public interface DocumentStatusListener {
    DocumentStatusListener NONE = (documentId, status, lastError) -> {
    };

    void onStatusChange(String documentId, DocumentStatus status, String lastError);
}
