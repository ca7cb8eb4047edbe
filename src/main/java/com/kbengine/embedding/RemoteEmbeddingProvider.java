package com.kbengine.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbengine.error.ProviderException;
import com.kbengine.error.RateLimitedException;
import com.kbengine.resilience.RetryPolicy;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class RemoteEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(RemoteEmbeddingProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final EmbeddingProviderConfig config;
    private final String endpoint;
    private final String apiKey;
    private final RetryPolicy retryPolicy;

    public RemoteEmbeddingProvider(OkHttpClient httpClient,
            EmbeddingProviderConfig config,
            String endpoint,
            String apiKey,
            RetryPolicy retryPolicy) {
        this.httpClient = httpClient;
        this.config = config;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            return retryPolicy.execute(() -> call(texts));
        } catch (IOException e) {
            throw new ProviderException(name(), "request failed after retries: " + e.getMessage(), false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(name(), "embedding request interrupted", false, e);
        }
    }

    @Override
    public int dimensionality() {
        return config.dimensionality();
    }

    @Override
    public ProviderDescription describe() {
        boolean available = endpoint != null && !endpoint.isBlank();
        return new ProviderDescription(name(), "remote", available);
    }

    private String name() {
        return "remote:" + config.modelId();
    }

    private List<float[]> call(List<String> texts) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.modelId());
        payload.put("input", texts);
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful()) {
                throw failureFor(response);
            }
            if (response.body() == null) {
                throw new ProviderException(name(), "empty response body", false);
            }
            String body = response.body().string();
            JsonNode root;
            try {
                root = mapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new ProviderException(name(), "malformed response: " + e.getOriginalMessage(), false, e);
            }
            return parse(root, texts.size());
        }
    }

    private ProviderException failureFor(Response response) {
        int code = response.code();
        log.warn("embedding.remote.failed provider={} status={}", name(), code);
        if (code == 401 || code == 403) {
            return new ProviderException(name(), "authentication failed (HTTP " + code + ")", false);
        }
        if (code == 404) {
            return new ProviderException(name(), "model not found: " + config.modelId(), false);
        }
        if (code == 429) {
            return new RateLimitedException(name(), retryAfterMillis(response.header("Retry-After")));
        }
        return new ProviderException(name(), "HTTP " + code, code >= 500);
    }

    private List<float[]> parse(JsonNode root, int expected) {
        List<JsonNode> vectorNodes = new ArrayList<>();
        if (root.path("data").isArray()) {
            root.path("data").forEach(item -> vectorNodes.add(item.path("embedding")));
        } else if (root.path("embeddings").isArray()) {
            root.path("embeddings").forEach(vectorNodes::add);
        }
        if (vectorNodes.size() != expected) {
            throw new ProviderException(name(), "expected " + expected + " embeddings, got " + vectorNodes.size(), false);
        }

        List<float[]> vectors = new ArrayList<>(expected);
        for (JsonNode vectorNode : vectorNodes) {
            if (!vectorNode.isArray() || vectorNode.size() != config.dimensionality()) {
                throw new ProviderException(name(), "embedding has wrong dimensionality, expected " + config.dimensionality(), false);
            }
            float[] out = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                out[i] = (float) vectorNode.get(i).asDouble();
            }
            vectors.add(out);
        }
        return vectors;
    }

    private static long retryAfterMillis(String header) {
        if (header == null || header.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(header.trim()) * 1000L;
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
