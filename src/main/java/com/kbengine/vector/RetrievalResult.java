package com.kbengine.vector;

public record RetrievalResult(
        String chunkId,
        float score,
        String namespace,
        String documentId,
        String snippet,
        String sourceLabel,
        int startOffset,
        int endOffset) {

    public boolean overlaps(RetrievalResult other) {
        return documentId.equals(other.documentId)
                && startOffset < other.endOffset
                && other.startOffset < endOffset;
    }
}
