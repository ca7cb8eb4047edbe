package com.kbengine.vector;

public record RecordMetadata(
        String documentId,
        String ownerScope,
        String sourceLabel,
        int sequenceIndex,
        int startOffset,
        int endOffset,
        String text) {

    public String valueOf(String key) {
        return switch (key) {
            case "documentId" -> documentId;
            case "ownerScope" -> ownerScope;
            case "sourceLabel" -> sourceLabel;
            case "sequenceIndex" -> Integer.toString(sequenceIndex);
            default -> null;
        };
    }
}
