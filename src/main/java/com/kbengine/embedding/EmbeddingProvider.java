package com.kbengine.embedding;

import java.util.List;

public interface EmbeddingProvider {
    List<float[]> embed(List<String> texts);

    int dimensionality();

    ProviderDescription describe();
}
