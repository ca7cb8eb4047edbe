package com.kbengine.ingest;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import com.kbengine.error.ValidationException;
import com.kbengine.vector.OwnerScope;

public class Document {
    private final String id;
    private final OwnerScope ownerScope;
    private final String contentRef;
    private final String sourceLabel;
    private final long createdAtEpochMs;
    private final AtomicReference<DocumentState> state;

    public Document(String id, OwnerScope ownerScope, String contentRef, String sourceLabel, long createdAtEpochMs) {
        this(id, ownerScope, contentRef, sourceLabel, createdAtEpochMs, DocumentState.pending(createdAtEpochMs));
    }

    Document(String id, OwnerScope ownerScope, String contentRef, String sourceLabel, long createdAtEpochMs, DocumentState initial) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("document id is required");
        }
        this.id = id;
        this.ownerScope = Objects.requireNonNull(ownerScope, "ownerScope");
        this.contentRef = Objects.requireNonNull(contentRef, "contentRef");
        this.sourceLabel = sourceLabel == null || sourceLabel.isBlank() ? id : sourceLabel;
        this.createdAtEpochMs = createdAtEpochMs;
        this.state = new AtomicReference<>(initial);
    }

    public boolean compareAndTransition(DocumentStatus expected, DocumentStatus next, String error, long nowEpochMs) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException("illegal document transition " + expected + " -> " + next);
        }
        while (true) {
            DocumentState current = state.get();
            if (current.status() != expected) {
                return false;
            }
            if (state.compareAndSet(current, current.withStatus(next, error, nowEpochMs))) {
                return true;
            }
        }
    }

    public void transition(DocumentStatus next, String error, long nowEpochMs) {
        while (true) {
            DocumentState current = state.get();
            if (!current.status().canTransitionTo(next)) {
                throw new IllegalStateException("document " + id + " cannot move from " + current.status() + " to " + next);
            }
            if (state.compareAndSet(current, current.withStatus(next, error, nowEpochMs))) {
                return;
            }
        }
    }

    public DocumentState update(UnaryOperator<DocumentState> change) {
        return state.updateAndGet(current -> {
            DocumentState next = change.apply(current);
            if (next.status() != current.status()) {
                throw new IllegalStateException("status changes must go through transition()");
            }
            return next;
        });
    }

    public String id() {
        return id;
    }

    public OwnerScope ownerScope() {
        return ownerScope;
    }

    public String contentRef() {
        return contentRef;
    }

    public String sourceLabel() {
        return sourceLabel;
    }

    public long createdAtEpochMs() {
        return createdAtEpochMs;
    }

    public DocumentState state() {
        return state.get();
    }

    public DocumentStatus status() {
        return state.get().status();
    }

    DocumentSnapshot snapshot() {
        return new DocumentSnapshot(id, ownerScope.toString(), contentRef, sourceLabel, createdAtEpochMs, state.get());
    }

    static Document fromSnapshot(DocumentSnapshot snapshot) {
        return new Document(
                snapshot.id(),
                OwnerScope.parse(snapshot.ownerScope()),
                snapshot.contentRef(),
                snapshot.sourceLabel(),
                snapshot.createdAtEpochMs(),
                snapshot.state());
    }

    record DocumentSnapshot(
            String id,
            String ownerScope,
            String contentRef,
            String sourceLabel,
            long createdAtEpochMs,
            DocumentState state) {
    }
}
