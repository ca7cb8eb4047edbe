package com.kbengine.vector;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbengine.error.KnowledgeEngineException;
import com.kbengine.error.ServiceUnavailableException;
import com.kbengine.error.ValidationException;
import com.kbengine.error.VectorStoreException;
import com.kbengine.resilience.CircuitBreaker;
import com.kbengine.resilience.RetryPolicy;
import com.kbengine.resilience.Sleeper;
import com.kbengine.runtime.AppConfig;

public class VectorStoreClient {
    private static final Logger log = LoggerFactory.getLogger(VectorStoreClient.class);

    private final VectorStore store;
    private final int dimensionality;
    private final int snippetLength;
    private final Map<Operation, Guard> guards;

    public VectorStoreClient(VectorStore store, int dimensionality, int snippetLength, Map<Operation, Guard> guards) {
        for (Operation operation : Operation.values()) {
            if (!guards.containsKey(operation)) {
                throw new ValidationException("missing resilience settings for vector store " + operation.label());
            }
        }
        this.store = store;
        this.dimensionality = dimensionality;
        this.snippetLength = snippetLength;
        this.guards = new EnumMap<>(guards);
    }

    public static VectorStoreClient fromConfig(VectorStore store,
            AppConfig.VectorStoreConfig config,
            int snippetLength,
            Clock clock,
            Sleeper sleeper) {
        Map<Operation, Guard> guards = new EnumMap<>(Operation.class);
        guards.put(Operation.UPSERT, Guard.from(Operation.UPSERT, config.getUpsert(), clock, sleeper));
        guards.put(Operation.QUERY, Guard.from(Operation.QUERY, config.getQuery(), clock, sleeper));
        guards.put(Operation.DELETE, Guard.from(Operation.DELETE, config.getDelete(), clock, sleeper));
        return new VectorStoreClient(store, config.getDimensionality(), snippetLength, guards);
    }

    public void upsert(String namespace, List<VectorRecord> records) {
        requireNamespace(namespace);
        for (VectorRecord record : records) {
            if (record.vector() == null || record.vector().length != dimensionality) {
                throw new ValidationException("record " + record.chunkId() + " has dimensionality "
                        + (record.vector() == null ? 0 : record.vector().length) + ", namespace " + namespace
                        + " expects " + dimensionality);
            }
            if (!namespace.equals(record.namespace())) {
                throw new ValidationException("record " + record.chunkId() + " belongs to namespace "
                        + record.namespace() + ", not " + namespace);
            }
        }
        if (records.isEmpty()) {
            return;
        }
        call(Operation.UPSERT, namespace, () -> {
            store.upsert(namespace, records);
            return null;
        });
        log.debug("vector.upsert namespace={} records={}", namespace, records.size());
    }

    public List<RetrievalResult> query(String namespace, float[] vector, int topK, Map<String, String> filter) {
        requireNamespace(namespace);
        if (vector == null || vector.length != dimensionality) {
            throw new ValidationException("query vector must have dimensionality " + dimensionality);
        }
        if (topK <= 0) {
            throw new ValidationException("topK must be > 0, got " + topK);
        }
        List<VectorMatch> matches = call(Operation.QUERY, namespace,
                () -> store.query(namespace, vector, topK, filter == null ? Map.of() : filter));
        return matches.stream()
                .map(match -> toResult(namespace, match))
                .toList();
    }

    public void delete(String namespace, List<String> ids) {
        requireNamespace(namespace);
        if (ids.isEmpty()) {
            return;
        }
        call(Operation.DELETE, namespace, () -> {
            store.delete(namespace, ids);
            return null;
        });
        log.debug("vector.delete namespace={} ids={}", namespace, ids.size());
    }

    public CircuitBreaker.State breakerState(Operation operation) {
        return guards.get(operation).breaker().state();
    }

    public int dimensionality() {
        return dimensionality;
    }

    private <T> T call(Operation operation, String namespace, RetryPolicy.Attempt<T> attempt) {
        Guard guard = guards.get(operation);
        try {
            return guard.retry().execute(() -> {
                CircuitBreaker.Permit permit = guard.breaker().acquire()
                        .orElseThrow(() -> new ServiceUnavailableException(operation.label(), namespace));
                try {
                    T result = attempt.run();
                    permit.success();
                    return result;
                } catch (InterruptedIOException e) {
                    throw e;
                } catch (IOException | RuntimeException e) {
                    permit.failure();
                    throw e;
                } finally {
                    // cancelled or errored calls settle without an outcome
                    permit.release();
                }
            });
        } catch (KnowledgeEngineException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new VectorStoreException(operation.label(), namespace, String.valueOf(e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VectorStoreException(operation.label(), namespace, "interrupted", e);
        }
    }

    private RetrievalResult toResult(String namespace, VectorMatch match) {
        RecordMetadata metadata = match.record().metadata();
        return new RetrievalResult(
                match.record().chunkId(),
                match.score(),
                namespace,
                metadata.documentId(),
                snippet(metadata.text()),
                metadata.sourceLabel(),
                metadata.startOffset(),
                metadata.endOffset());
    }

    private String snippet(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = text.strip().replaceAll("\\s+", " ");
        if (collapsed.length() > snippetLength) {
            return collapsed.substring(0, snippetLength) + "...";
        }
        return collapsed;
    }

    private static void requireNamespace(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new ValidationException("namespace is required");
        }
    }

    public enum Operation {
        UPSERT("upsert"),
        QUERY("query"),
        DELETE("delete");

        private final String label;

        Operation(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public record Guard(RetryPolicy retry, CircuitBreaker breaker) {
        static Guard from(Operation operation, AppConfig.OperationConfig config, Clock clock, Sleeper sleeper) {
            return new Guard(
                    new RetryPolicy(
                            "vector-" + operation.label(),
                            config.getMaxAttempts(),
                            config.getInitialDelayMs(),
                            config.getMaxDelayMs(),
                            config.getBackoffFactor(),
                            sleeper),
                    new CircuitBreaker(
                            "vector-" + operation.label(),
                            config.getFailureThreshold(),
                            Duration.ofMillis(config.getResetTimeoutMs()),
                            clock));
        }
    }
}
