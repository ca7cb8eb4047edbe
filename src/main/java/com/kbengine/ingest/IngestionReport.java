package com.kbengine.ingest;

public record IngestionReport(
        String documentId,
        DocumentStatus status,
        int chunkCount,
        int embeddedChunks,
        int failedChunks,
        int upsertedBatches,
        int skippedBatches,
        String lastError) {
}
