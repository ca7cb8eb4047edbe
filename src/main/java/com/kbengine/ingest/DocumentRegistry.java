package com.kbengine.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbengine.error.NotFoundException;

public class DocumentRegistry {
    private static final Logger log = LoggerFactory.getLogger(DocumentRegistry.class);

    private final Map<String, Document> documents = new ConcurrentHashMap<>();
    private final ObjectMapper mapper = new ObjectMapper();

    public Document register(Document document) {
        Document existing = documents.putIfAbsent(document.id(), document);
        return existing == null ? document : existing;
    }

    public Document get(String documentId) {
        Document document = documents.get(documentId);
        if (document == null) {
            throw new NotFoundException("document not found: " + documentId);
        }
        return document;
    }

    public Optional<Document> find(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    public Collection<Document> all() {
        return documents.values().stream()
                .sorted(Comparator.comparing(Document::id))
                .toList();
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        List<Document.DocumentSnapshot> snapshots = all().stream().map(Document::snapshot).toList();
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), snapshots);
    }

    public static DocumentRegistry load(Path path, long nowEpochMs) throws IOException {
        DocumentRegistry registry = new DocumentRegistry();
        if (!Files.exists(path)) {
            return registry;
        }
        List<Document.DocumentSnapshot> snapshots = registry.mapper.readValue(path.toFile(),
                new TypeReference<List<Document.DocumentSnapshot>>() {
                });
        for (Document.DocumentSnapshot snapshot : snapshots) {
            Document document = Document.fromSnapshot(snapshot);
            if (document.status().inFlight()) {
                log.warn("registry.interrupted documentId={} status={}", document.id(), document.status());
                document.transition(DocumentStatus.FAILED, "ingestion interrupted before completion", nowEpochMs);
            }
            registry.register(document);
        }
        return registry;
    }
}
