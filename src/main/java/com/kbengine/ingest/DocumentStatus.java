package com.kbengine.ingest;

import java.util.EnumSet;
import java.util.Set;

// FAILED and INDEXED go back to PENDING on a re-ingest request; everything else moves forward.
public enum DocumentStatus {
    PENDING,
    CHUNKING,
    EMBEDDING,
    INDEXED,
    FAILED;

    public Set<DocumentStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(CHUNKING, FAILED);
            case CHUNKING -> EnumSet.of(EMBEDDING, FAILED);
            case EMBEDDING -> EnumSet.of(INDEXED, FAILED);
            case INDEXED, FAILED -> EnumSet.of(PENDING);
        };
    }

    public boolean canTransitionTo(DocumentStatus next) {
        return successors().contains(next);
    }

    public boolean inFlight() {
        return this == CHUNKING || this == EMBEDDING;
    }
}
