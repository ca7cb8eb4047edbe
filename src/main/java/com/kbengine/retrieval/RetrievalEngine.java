package com.kbengine.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbengine.embedding.EmbeddingProvider;
import com.kbengine.error.ServiceUnavailableException;
import com.kbengine.error.ValidationException;
import com.kbengine.runtime.AppConfig;
import com.kbengine.vector.Namespaces;
import com.kbengine.vector.RetrievalResult;
import com.kbengine.vector.SourceKind;
import com.kbengine.vector.VectorStoreClient;

/**
 * Answers a query across every namespace the principal may read. The query is embedded
 * once, each namespace is queried concurrently under one overall deadline, and whatever
 * arrived in time is merged, ranked and de-duplicated. A namespace that fails, times out
 * or has its breaker open is reported as omitted rather than failing the request.
 */
public class RetrievalEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetrievalEngine.class);

    private final KnowledgeSourceRouter router;
    private final EmbeddingProvider provider;
    private final VectorStoreClient vectorStore;
    private final Namespaces namespaces;
    private final Settings settings;
    private final ExecutorService queryExecutor;
    private final ExecutorService requestExecutor;

    public RetrievalEngine(
            KnowledgeSourceRouter router,
            EmbeddingProvider provider,
            VectorStoreClient vectorStore,
            Namespaces namespaces,
            Settings settings) {
        if (provider == null) {
            throw new ValidationException("no embedding provider configured");
        }
        this.router = router;
        this.provider = provider;
        this.vectorStore = vectorStore;
        this.namespaces = namespaces;
        this.settings = settings;
        this.queryExecutor = Executors.newFixedThreadPool(settings.queryThreads(), daemon("retrieval-query"));
        this.requestExecutor = Executors.newCachedThreadPool(daemon("retrieval-request"));
    }

    public RetrievalResponse retrieve(Principal principal, String query, SearchMode mode) {
        return retrieve(principal, query, mode, settings.defaultTopK());
    }

    public Future<RetrievalResponse> submit(Principal principal, String query, SearchMode mode, int topK) {
        return requestExecutor.submit(() -> retrieve(principal, query, mode, topK));
    }

    public RetrievalResponse retrieve(Principal principal, String query, SearchMode mode, int topK) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("query text is required");
        }
        if (topK <= 0) {
            throw new ValidationException("topK must be > 0, got " + topK);
        }
        List<String> targets = router.resolveNamespaces(principal, mode);
        float[] vector = provider.embed(List.of(query)).get(0);
        int fetch = Math.max(topK + 1, topK * settings.overfetchFactor());

        Map<String, Future<List<RetrievalResult>>> futures = new LinkedHashMap<>();
        for (String namespace : targets) {
            futures.put(namespace, queryExecutor.submit(() -> vectorStore.query(namespace, vector, fetch, Map.of())));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.requestTimeoutMs());
        List<RetrievalResult> gathered = new ArrayList<>();
        Map<String, String> omitted = new LinkedHashMap<>();
        for (Map.Entry<String, Future<List<RetrievalResult>>> entry : futures.entrySet()) {
            String namespace = entry.getKey();
            Future<List<RetrievalResult>> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                gathered.addAll(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                omitted.put(namespace, "timed out");
                log.warn("retrieval.namespace.timeout namespace={} timeoutMs={}", namespace, settings.requestTimeoutMs());
            } catch (ExecutionException e) {
                String reason = e.getCause() instanceof ServiceUnavailableException
                        ? "circuit breaker open"
                        : String.valueOf(e.getCause().getMessage());
                omitted.put(namespace, reason);
                log.warn("retrieval.namespace.failed namespace={} reason={}", namespace, reason);
            } catch (InterruptedException e) {
                futures.values().forEach(pending -> pending.cancel(true));
                Thread.currentThread().interrupt();
                throw new CancellationException("retrieval cancelled");
            }
        }

        List<RetrievalResult> results = merge(gathered, new HashSet<>(targets), topK);
        if (results.isEmpty()) {
            log.info("retrieval.no-context mode={} namespaces={} omitted={}", mode, targets.size(), omitted.size());
        } else {
            log.debug("retrieval.done mode={} results={} omitted={}", mode, results.size(), omitted.size());
        }
        return new RetrievalResponse(query, mode, results, targets, omitted);
    }

    List<RetrievalResult> merge(List<RetrievalResult> gathered, Set<String> allowedNamespaces, int topK) {
        List<RetrievalResult> candidates = new ArrayList<>();
        for (RetrievalResult result : gathered) {
            if (!allowedNamespaces.contains(result.namespace())) {
                log.warn("retrieval.contamination chunkId={} namespace={}", result.chunkId(), result.namespace());
                continue;
            }
            if (result.score() < settings.minScore()) {
                continue;
            }
            candidates.add(result);
        }
        candidates.sort(ranking());

        List<RetrievalResult> kept = new ArrayList<>();
        for (RetrievalResult candidate : candidates) {
            if (kept.size() == topK) {
                break;
            }
            if (kept.stream().noneMatch(candidate::overlaps)) {
                kept.add(candidate);
            }
        }
        return List.copyOf(kept);
    }

    private Comparator<RetrievalResult> ranking() {
        return Comparator.comparingDouble((RetrievalResult result) -> result.score()).reversed()
                .thenComparingInt(result -> sourceRank(result.namespace()))
                .thenComparing(RetrievalResult::namespace)
                .thenComparing(RetrievalResult::documentId)
                .thenComparing(RetrievalResult::chunkId);
    }

    private int sourceRank(String namespace) {
        return namespaces.kindOf(namespace)
                .map(SourceKind::ordinal)
                .orElse(SourceKind.values().length);
    }

    private static java.util.concurrent.ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        requestExecutor.shutdownNow();
        queryExecutor.shutdownNow();
    }

    public record Settings(
            int defaultTopK,
            int overfetchFactor,
            long requestTimeoutMs,
            double minScore,
            int queryThreads) {

        public Settings {
            if (defaultTopK <= 0) {
                throw new ValidationException("defaultTopK must be > 0");
            }
            if (overfetchFactor < 1) {
                throw new ValidationException("overfetchFactor must be >= 1");
            }
            if (requestTimeoutMs <= 0) {
                throw new ValidationException("requestTimeoutMs must be > 0");
            }
            if (queryThreads <= 0) {
                throw new ValidationException("queryThreads must be > 0");
            }
        }

        public static Settings from(AppConfig.RetrievalConfig config) {
            return new Settings(
                    config.getDefaultTopK(),
                    config.getOverfetchFactor(),
                    config.getRequestTimeoutMs(),
                    config.getMinScore(),
                    config.getQueryThreads());
        }
    }
}
