package com.kbengine.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.kbengine.runtime.AcceleratorProbe;

public class LocalEmbeddingProvider implements EmbeddingProvider {
    private final EmbeddingProviderConfig config;
    private final LocalModelCatalog catalog;
    private final AcceleratorProbe.DeviceSelection device;

    public LocalEmbeddingProvider(EmbeddingProviderConfig config, LocalModelCatalog catalog, AcceleratorProbe probe) {
        this.config = config;
        this.catalog = catalog;
        this.device = probe.select(config.deviceCapability());
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text));
        }
        return vectors;
    }

    @Override
    public int dimensionality() {
        return config.dimensionality();
    }

    @Override
    public ProviderDescription describe() {
        boolean cached = catalog.find(config.modelId()).map(LocalModel::available).orElse(false);
        return new ProviderDescription("local:" + config.modelId(), device.device(), cached);
    }

    public List<LocalModel> discoverModels() {
        return catalog.discover();
    }

    public AcceleratorProbe.DeviceSelection deviceSelection() {
        return device;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[config.dimensionality()];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String[] tokens = text.toLowerCase(Locale.ROOT).split("\\W+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
        }
        normalize(vector);
        return vector;
    }

    private static void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    private static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
