package com.kbengine.embedding;

import java.nio.file.Path;

public record LocalModel(String id, Path path, long sizeBytes, int dimensionality, boolean available) {
}
