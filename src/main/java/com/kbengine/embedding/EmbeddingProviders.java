package com.kbengine.embedding;

import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbengine.error.ValidationException;
import com.kbengine.resilience.RetryPolicy;
import com.kbengine.resilience.Sleeper;
import com.kbengine.runtime.AcceleratorProbe;
import com.kbengine.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingProviders.class);

    private EmbeddingProviders() {
    }

    public static EmbeddingProvider fromConfig(AppConfig.EmbeddingConfig embedding, OkHttpClient httpClient) {
        return fromConfig(embedding, httpClient, System.getenv(), new AcceleratorProbe(), Sleeper.THREAD);
    }

    static EmbeddingProvider fromConfig(AppConfig.EmbeddingConfig embedding,
            OkHttpClient httpClient,
            Map<String, String> environment,
            AcceleratorProbe probe,
            Sleeper sleeper) {
        if (embedding == null) {
            throw new ValidationException("no embedding provider configured");
        }
        EmbeddingProviderConfig config = new EmbeddingProviderConfig(
                EmbeddingProviderConfig.ProviderType.parse(embedding.getProviderType()),
                embedding.getModelId(),
                embedding.getDimensionality(),
                embedding.getDeviceCapability());

        EmbeddingProvider provider;
        if (config.providerType() == EmbeddingProviderConfig.ProviderType.REMOTE) {
            AppConfig.RemoteConfig remote = embedding.getRemote();
            if (remote.getEndpoint() == null || remote.getEndpoint().isBlank()) {
                throw new ValidationException("remote embedding provider requires embedding.remote.endpoint");
            }
            AppConfig.RetryConfig retry = remote.getRetry();
            RetryPolicy retryPolicy = new RetryPolicy(
                    "embedding-remote",
                    retry.getMaxAttempts(),
                    retry.getInitialDelayMs(),
                    retry.getMaxDelayMs(),
                    retry.getBackoffFactor(),
                    sleeper);
            String apiKey = remote.getApiKeyEnv() == null ? null : environment.get(remote.getApiKeyEnv());
            OkHttpClient client = httpClient.newBuilder()
                    .callTimeout(java.time.Duration.ofMillis(remote.getTimeoutMs()))
                    .build();
            provider = new RemoteEmbeddingProvider(client, config, remote.getEndpoint(), apiKey, retryPolicy);
        } else {
            Path cacheDir = embedding.getModelCacheDir() == null || embedding.getModelCacheDir().isBlank()
                    ? LocalModelCatalog.defaultCacheDir()
                    : Path.of(embedding.getModelCacheDir());
            provider = new LocalEmbeddingProvider(config, new LocalModelCatalog(cacheDir), probe);
        }

        ProviderDescription description = provider.describe();
        log.info("embedding.provider name={} device={} available={} dimensionality={}",
                description.name(), description.device(), description.available(), provider.dimensionality());
        return provider;
    }
}
