package com.kbengine.vector;

public record VectorRecord(String chunkId, float[] vector, String namespace, RecordMetadata metadata) {
}
