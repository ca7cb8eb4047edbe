package com.kbengine.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ChunkingConfig chunking = new ChunkingConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private VectorStoreConfig vectorStore = new VectorStoreConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public VectorStoreConfig getVectorStore() {
        return vectorStore;
    }

    public void setVectorStore(VectorStoreConfig vectorStore) {
        this.vectorStore = vectorStore == null ? new VectorStoreConfig() : vectorStore;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int maxChunkSize = 1500;
        private int overlap = 300;
        private int lookback = 375;

        public int getMaxChunkSize() {
            return maxChunkSize;
        }

        public void setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }

        public int getLookback() {
            return lookback;
        }

        public void setLookback(int lookback) {
            this.lookback = lookback;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String providerType = "local";
        private String modelId = "sentence-transformers/all-MiniLM-L6-v2";
        private int dimensionality = 384;
        private String deviceCapability = "auto";
        private String modelCacheDir;
        private int batchSize = 16;
        private int workerThreads = 4;
        private int chunkRetryLimit = 2;
        private RemoteConfig remote = new RemoteConfig();

        public String getProviderType() {
            return providerType;
        }

        public void setProviderType(String providerType) {
            this.providerType = providerType;
        }

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public int getDimensionality() {
            return dimensionality;
        }

        public void setDimensionality(int dimensionality) {
            this.dimensionality = dimensionality;
        }

        public String getDeviceCapability() {
            return deviceCapability;
        }

        public void setDeviceCapability(String deviceCapability) {
            this.deviceCapability = deviceCapability;
        }

        public String getModelCacheDir() {
            return modelCacheDir;
        }

        public void setModelCacheDir(String modelCacheDir) {
            this.modelCacheDir = modelCacheDir;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getChunkRetryLimit() {
            return chunkRetryLimit;
        }

        public void setChunkRetryLimit(int chunkRetryLimit) {
            this.chunkRetryLimit = chunkRetryLimit;
        }

        public RemoteConfig getRemote() {
            return remote;
        }

        public void setRemote(RemoteConfig remote) {
            this.remote = remote == null ? new RemoteConfig() : remote;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RemoteConfig {
        private String endpoint = "";
        private String apiKeyEnv = "KBENGINE_EMBEDDING_API_KEY";
        private int timeoutMs = 30000;
        private RetryConfig retry = new RetryConfig();

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public RetryConfig getRetry() {
            return retry;
        }

        public void setRetry(RetryConfig retry) {
            this.retry = retry == null ? new RetryConfig() : retry;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long initialDelayMs = 1000;
        private long maxDelayMs = 5000;
        private double backoffFactor = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OperationConfig extends RetryConfig {
        private int failureThreshold = 3;
        private long resetTimeoutMs = 60000;

        static OperationConfig of(long maxDelayMs, int failureThreshold, long resetTimeoutMs) {
            OperationConfig config = new OperationConfig();
            config.setMaxDelayMs(maxDelayMs);
            config.setFailureThreshold(failureThreshold);
            config.setResetTimeoutMs(resetTimeoutMs);
            return config;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getResetTimeoutMs() {
            return resetTimeoutMs;
        }

        public void setResetTimeoutMs(long resetTimeoutMs) {
            this.resetTimeoutMs = resetTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorStoreConfig {
        private String namespacePrefix = "local";
        private int dimensionality = 384;
        private OperationConfig upsert = OperationConfig.of(5000, 3, 60000);
        private OperationConfig query = OperationConfig.of(3000, 5, 30000);
        private OperationConfig delete = OperationConfig.of(5000, 3, 60000);

        public String getNamespacePrefix() {
            return namespacePrefix;
        }

        public void setNamespacePrefix(String namespacePrefix) {
            this.namespacePrefix = namespacePrefix;
        }

        public int getDimensionality() {
            return dimensionality;
        }

        public void setDimensionality(int dimensionality) {
            this.dimensionality = dimensionality;
        }

        public OperationConfig getUpsert() {
            return upsert;
        }

        public void setUpsert(OperationConfig upsert) {
            this.upsert = upsert == null ? OperationConfig.of(5000, 3, 60000) : upsert;
        }

        public OperationConfig getQuery() {
            return query;
        }

        public void setQuery(OperationConfig query) {
            this.query = query == null ? OperationConfig.of(3000, 5, 30000) : query;
        }

        public OperationConfig getDelete() {
            return delete;
        }

        public void setDelete(OperationConfig delete) {
            this.delete = delete == null ? OperationConfig.of(5000, 3, 60000) : delete;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private int upsertBatchSize = 100;
        private long interBatchDelayMs = 500;
        private int concurrentDocuments = 2;

        public int getUpsertBatchSize() {
            return upsertBatchSize;
        }

        public void setUpsertBatchSize(int upsertBatchSize) {
            this.upsertBatchSize = upsertBatchSize;
        }

        public long getInterBatchDelayMs() {
            return interBatchDelayMs;
        }

        public void setInterBatchDelayMs(long interBatchDelayMs) {
            this.interBatchDelayMs = interBatchDelayMs;
        }

        public int getConcurrentDocuments() {
            return concurrentDocuments;
        }

        public void setConcurrentDocuments(int concurrentDocuments) {
            this.concurrentDocuments = concurrentDocuments;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int defaultTopK = 5;
        private int overfetchFactor = 3;
        private long requestTimeoutMs = 5000;
        private int snippetLength = 240;
        private double minScore = 0.0;
        private int queryThreads = 8;

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public int getOverfetchFactor() {
            return overfetchFactor;
        }

        public void setOverfetchFactor(int overfetchFactor) {
            this.overfetchFactor = overfetchFactor;
        }

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }

        public int getSnippetLength() {
            return snippetLength;
        }

        public void setSnippetLength(int snippetLength) {
            this.snippetLength = snippetLength;
        }

        public double getMinScore() {
            return minScore;
        }

        public void setMinScore(double minScore) {
            this.minScore = minScore;
        }

        public int getQueryThreads() {
            return queryThreads;
        }

        public void setQueryThreads(int queryThreads) {
            this.queryThreads = queryThreads;
        }
    }
}
