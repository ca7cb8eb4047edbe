package com.kbengine.vector;

public record VectorMatch(VectorRecord record, float score) {
}
