package com.kbengine.vector;

import java.io.IOException;
import java.util.List;
import java.util.Map;

public interface VectorStore {
    void upsert(String namespace, List<VectorRecord> records) throws IOException;

    List<VectorMatch> query(String namespace, float[] vector, int topK, Map<String, String> filter) throws IOException;

    void delete(String namespace, List<String> ids) throws IOException;
}
