package com.kbengine.ingest;

// upsertedBatches counts leading batches fully stored for contentChecksum;
// storedRecordLimit is one past the highest record index any version may have left behind.
public record DocumentState(
        DocumentStatus status,
        int chunkCount,
        String lastError,
        int upsertedBatches,
        String contentChecksum,
        long updatedAtEpochMs,
        int storedRecordLimit) {

    public static DocumentState pending(long nowEpochMs) {
        return new DocumentState(DocumentStatus.PENDING, 0, null, 0, null, nowEpochMs, 0);
    }

    public DocumentState withStatus(DocumentStatus next, String error, long nowEpochMs) {
        return new DocumentState(next, chunkCount, error, upsertedBatches, contentChecksum, nowEpochMs, storedRecordLimit);
    }

    public DocumentState withChunks(int count, String checksum) {
        return new DocumentState(status, count, lastError, upsertedBatches, checksum, updatedAtEpochMs, storedRecordLimit);
    }

    public DocumentState withUpsertedBatches(int batches) {
        return new DocumentState(status, chunkCount, lastError, batches, contentChecksum, updatedAtEpochMs, storedRecordLimit);
    }

    public DocumentState withStoredRecordLimit(int limit) {
        return new DocumentState(status, chunkCount, lastError, upsertedBatches, contentChecksum, updatedAtEpochMs, limit);
    }

    public int recordSlots() {
        return Math.max(storedRecordLimit, chunkCount);
    }
}
