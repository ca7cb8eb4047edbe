package com.kbengine.vector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

public class InMemoryVectorStore implements VectorStore {
    private final Map<String, Map<String, VectorRecord>> namespaces = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void upsert(String namespace, List<VectorRecord> records) {
        Map<String, VectorRecord> target = namespaces.computeIfAbsent(namespace, unused -> new ConcurrentHashMap<>());
        for (VectorRecord record : records) {
            target.put(record.chunkId(), record);
        }
    }

    @Override
    public List<VectorMatch> query(String namespace, float[] vector, int topK, Map<String, String> filter) {
        Map<String, VectorRecord> records = namespaces.getOrDefault(namespace, Map.of());
        return records.values().stream()
                .filter(record -> matches(record, filter))
                .map(record -> new VectorMatch(record, cosine(vector, record.vector())))
                .sorted(Comparator.comparing(VectorMatch::score).reversed()
                        .thenComparing(match -> match.record().chunkId()))
                .limit(topK)
                .toList();
    }

    @Override
    public void delete(String namespace, List<String> ids) {
        Map<String, VectorRecord> records = namespaces.get(namespace);
        if (records == null) {
            return;
        }
        ids.forEach(records::remove);
    }

    public int size(String namespace) {
        return namespaces.getOrDefault(namespace, Map.of()).size();
    }

    public List<String> ids(String namespace) {
        return namespaces.getOrDefault(namespace, Map.of()).keySet().stream().sorted().toList();
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        List<VectorRecord> all = new ArrayList<>();
        namespaces.values().forEach(records -> all.addAll(records.values()));
        all.sort(Comparator.comparing(VectorRecord::namespace).thenComparing(VectorRecord::chunkId));
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), all);
    }

    public static InMemoryVectorStore load(Path path) throws IOException {
        InMemoryVectorStore store = new InMemoryVectorStore();
        if (!Files.exists(path)) {
            return store;
        }
        List<VectorRecord> loaded = store.objectMapper.readValue(path.toFile(), new TypeReference<List<VectorRecord>>() {
        });
        for (VectorRecord record : loaded) {
            store.upsert(record.namespace(), List.of(record));
        }
        return store;
    }

    private static boolean matches(VectorRecord record, Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        return filter.entrySet().stream()
                .allMatch(entry -> entry.getValue().equals(record.metadata().valueOf(entry.getKey())));
    }

    private static float cosine(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }
}
