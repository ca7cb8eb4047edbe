package com.kbengine.chunking;

public record Chunk(
        String id,
        String documentId,
        int sequenceIndex,
        String text,
        int tokenCount,
        String checksum,
        int startOffset,
        int endOffset) {

    public static String chunkId(String documentId, int sequenceIndex) {
        return documentId + "#" + sequenceIndex;
    }
}
