package com.kbengine.ingest;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbengine.chunking.Checksums;
import com.kbengine.chunking.Chunk;
import com.kbengine.chunking.Chunker;
import com.kbengine.embedding.EmbeddingProvider;
import com.kbengine.error.KnowledgeEngineException;
import com.kbengine.error.ValidationException;
import com.kbengine.resilience.Sleeper;
import com.kbengine.runtime.AppConfig;
import com.kbengine.vector.Namespaces;
import com.kbengine.vector.OwnerScope;
import com.kbengine.vector.RecordMetadata;
import com.kbengine.vector.VectorRecord;
import com.kbengine.vector.VectorStoreClient;

/**
 * Drives documents from {@code PENDING} to {@code INDEXED}. Each document runs its stages in
 * order on the document pool; the embedding batches of one document share a bounded worker
 * pool. Upserts are sent in fixed-size batches and the number of leading batches stored is
 * kept on the document, so a re-ingest of unchanged content picks up after the last stored
 * batch.
 */
public class IngestionPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final Chunker chunker;
    private final EmbeddingProvider provider;
    private final VectorStoreClient vectorStore;
    private final Namespaces namespaces;
    private final ContentStore contentStore;
    private final DocumentRegistry registry;
    private final Settings settings;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DocumentStatusListener listener;
    private final ExecutorService documentExecutor;
    private final ExecutorService embeddingExecutor;

    public IngestionPipeline(
            Chunker chunker,
            EmbeddingProvider provider,
            VectorStoreClient vectorStore,
            Namespaces namespaces,
            ContentStore contentStore,
            DocumentRegistry registry,
            Settings settings,
            DocumentStatusListener listener) {
        this(chunker, provider, vectorStore, namespaces, contentStore, registry, settings, listener,
                Clock.systemUTC(), Sleeper.THREAD);
    }

    IngestionPipeline(
            Chunker chunker,
            EmbeddingProvider provider,
            VectorStoreClient vectorStore,
            Namespaces namespaces,
            ContentStore contentStore,
            DocumentRegistry registry,
            Settings settings,
            DocumentStatusListener listener,
            Clock clock,
            Sleeper sleeper) {
        if (provider == null) {
            throw new ValidationException("no embedding provider configured");
        }
        if (provider.dimensionality() != vectorStore.dimensionality()) {
            throw new ValidationException("embedding provider produces " + provider.dimensionality()
                    + "-dimensional vectors but the vector store expects " + vectorStore.dimensionality());
        }
        this.chunker = chunker;
        this.provider = provider;
        this.vectorStore = vectorStore;
        this.namespaces = namespaces;
        this.contentStore = contentStore;
        this.registry = registry;
        this.settings = settings;
        this.listener = listener == null ? DocumentStatusListener.NONE : listener;
        this.clock = clock;
        this.sleeper = sleeper;
        this.documentExecutor = Executors.newFixedThreadPool(settings.concurrentDocuments(), named("ingest-doc"));
        this.embeddingExecutor = Executors.newFixedThreadPool(settings.embeddingWorkers(), named("ingest-embed"));
    }

    public Document register(String documentId, OwnerScope ownerScope, String contentRef, String sourceLabel) {
        return registry.register(new Document(documentId, ownerScope, contentRef, sourceLabel, clock.millis()));
    }

    public Future<IngestionReport> submit(String documentId) {
        return documentExecutor.submit(() -> ingest(documentId));
    }

    public IngestionReport reingest(String documentId) {
        requestReingest(documentId);
        return ingest(documentId);
    }

    public void requestReingest(String documentId) {
        Document document = registry.get(documentId);
        long now = clock.millis();
        if (document.compareAndTransition(DocumentStatus.FAILED, DocumentStatus.PENDING, null, now)
                || document.compareAndTransition(DocumentStatus.INDEXED, DocumentStatus.PENDING, null, now)) {
            notifyListener(document);
            return;
        }
        if (document.status() != DocumentStatus.PENDING) {
            throw new ValidationException("document " + documentId + " is being ingested (" + document.status() + ")");
        }
    }

    public IngestionReport ingest(String documentId) {
        Document document = registry.get(documentId);
        if (!document.compareAndTransition(DocumentStatus.PENDING, DocumentStatus.CHUNKING, null, clock.millis())) {
            throw new ValidationException("document " + documentId + " is " + document.status() + ", expected PENDING");
        }
        notifyListener(document);
        log.info("ingest.start documentId={} owner={}", documentId, document.ownerScope());
        try {
            return run(document);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(document, "ingestion cancelled", 0, 0, 0, 0);
        } catch (IOException e) {
            return fail(document, "content could not be read: " + e.getMessage(), 0, 0, 0, 0);
        } catch (KnowledgeEngineException e) {
            return fail(document, e.getMessage(), 0, 0, 0, 0);
        } catch (RuntimeException e) {
            fail(document, "unexpected ingestion error: " + e, 0, 0, 0, 0);
            throw e;
        }
    }

    public int purge(String documentId) {
        Document document = registry.get(documentId);
        if (document.status().inFlight()) {
            throw new ValidationException("document " + documentId + " is being ingested (" + document.status() + ")");
        }
        int slots = document.state().recordSlots();
        String namespace = namespaces.forOwner(document.ownerScope());
        vectorStore.delete(namespace, recordIds(documentId, 0, slots));
        document.update(state -> state.withChunks(0, null).withUpsertedBatches(0).withStoredRecordLimit(0));
        log.info("ingest.purged documentId={} namespace={} records={}", documentId, namespace, slots);
        return slots;
    }

    private IngestionReport run(Document document) throws IOException, InterruptedException {
        String text = contentStore.read(document.contentRef());
        List<Chunk> chunks = chunker.split(document.id(), text);
        if (chunks.isEmpty()) {
            return fail(document, "document has no indexable text", 0, 0, 0, 0);
        }
        String checksum = Checksums.sha256(text);
        DocumentState previous = document.state();
        int previousSlots = previous.recordSlots();
        int resumeFrom = checksum.equals(previous.contentChecksum())
                ? Math.min(previous.upsertedBatches(), batchCount(chunks.size()))
                : 0;
        document.update(state -> state.withChunks(chunks.size(), checksum)
                .withUpsertedBatches(resumeFrom)
                .withStoredRecordLimit(previousSlots));
        log.info("ingest.chunked documentId={} chunks={} resumeFromBatch={}", document.id(), chunks.size(), resumeFrom);

        document.transition(DocumentStatus.EMBEDDING, null, clock.millis());
        notifyListener(document);

        List<Chunk> pending = chunks.subList(resumeFrom * settings.upsertBatchSize(), chunks.size());
        EmbeddingOutcome embedded = embedAll(document.id(), pending);

        String namespace = namespaces.forOwner(document.ownerScope());
        int upserted = resumeFrom;
        boolean contiguous = true;
        for (int batch = resumeFrom; batch < batchCount(chunks.size()); batch++) {
            if (batch > resumeFrom && settings.interBatchDelayMs() > 0) {
                sleeper.sleep(settings.interBatchDelayMs());
            }
            List<Chunk> batchChunks = batchOf(chunks, batch);
            List<VectorRecord> records = new ArrayList<>();
            for (Chunk chunk : batchChunks) {
                float[] vector = embedded.vectors().get(chunk.sequenceIndex());
                if (vector != null) {
                    records.add(toRecord(document, namespace, chunk, vector));
                }
            }
            int batchEnd = batchChunks.get(batchChunks.size() - 1).sequenceIndex() + 1;
            // a failed upsert may still have stored part of the batch
            document.update(state -> state.withStoredRecordLimit(Math.max(state.storedRecordLimit(), batchEnd)));
            try {
                vectorStore.upsert(namespace, records);
            } catch (KnowledgeEngineException e) {
                log.warn("ingest.batch.failed documentId={} batch={} reason={}", document.id(), batch, e.getMessage());
                return fail(document, "upsert of batch " + batch + " failed: " + e.getMessage(),
                        embedded.vectors().size(), embedded.failed(), upserted - resumeFrom, resumeFrom);
            }
            if (contiguous && records.size() == batchChunks.size()) {
                upserted = batch + 1;
                int stored = upserted;
                document.update(state -> state.withUpsertedBatches(stored));
            } else {
                contiguous = false;
            }
            log.debug("ingest.batch.upserted documentId={} batch={} records={}", document.id(), batch, records.size());
        }

        if (embedded.failed() > 0) {
            List<String> emptySlots = pending.stream()
                    .filter(chunk -> !embedded.vectors().containsKey(chunk.sequenceIndex()))
                    .filter(chunk -> chunk.sequenceIndex() < previousSlots)
                    .map(Chunk::id)
                    .toList();
            deleteQuietly(document.id(), namespace, emptySlots);
            return fail(document, embedded.failed() + " of " + pending.size() + " chunks failed to embed"
                    + (embedded.lastError() == null ? "" : ": " + embedded.lastError()),
                    embedded.vectors().size(), embedded.failed(), upserted - resumeFrom, resumeFrom);
        }
        int storedLimit = document.state().storedRecordLimit();
        if (storedLimit <= chunks.size()
                || deleteQuietly(document.id(), namespace, recordIds(document.id(), chunks.size(), storedLimit))) {
            document.update(state -> state.withStoredRecordLimit(chunks.size()));
        }
        document.transition(DocumentStatus.INDEXED, null, clock.millis());
        notifyListener(document);
        log.info("ingest.indexed documentId={} namespace={} chunks={} skippedBatches={}",
                document.id(), namespace, chunks.size(), resumeFrom);
        return new IngestionReport(document.id(), DocumentStatus.INDEXED, chunks.size(), embedded.vectors().size(), 0,
                upserted - resumeFrom, resumeFrom, null);
    }

    private EmbeddingOutcome embedAll(String documentId, List<Chunk> chunks) throws InterruptedException {
        List<Future<EmbeddingOutcome>> futures = new ArrayList<>();
        for (int start = 0; start < chunks.size(); start += settings.embeddingBatchSize()) {
            List<Chunk> batch = chunks.subList(start, Math.min(chunks.size(), start + settings.embeddingBatchSize()));
            futures.add(embeddingExecutor.submit(() -> embedBatch(documentId, batch)));
        }
        Map<Integer, float[]> vectors = new LinkedHashMap<>();
        int failed = 0;
        String lastError = null;
        try {
            for (Future<EmbeddingOutcome> future : futures) {
                EmbeddingOutcome outcome = future.get();
                vectors.putAll(outcome.vectors());
                failed += outcome.failed();
                if (outcome.lastError() != null) {
                    lastError = outcome.lastError();
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            if (e.getCause() instanceof KnowledgeEngineException engineException) {
                throw engineException;
            }
            throw new IllegalStateException("embedding batch crashed for document " + documentId, e.getCause());
        } catch (CancellationException e) {
            futures.forEach(future -> future.cancel(true));
            throw new InterruptedException("embedding cancelled for document " + documentId);
        }
        return new EmbeddingOutcome(vectors, failed, lastError);
    }

    private EmbeddingOutcome embedBatch(String documentId, List<Chunk> batch) throws InterruptedException {
        Map<Integer, float[]> vectors = new LinkedHashMap<>();
        try {
            List<float[]> result = provider.embed(batch.stream().map(Chunk::text).toList());
            for (int i = 0; i < batch.size(); i++) {
                vectors.put(batch.get(i).sequenceIndex(), result.get(i));
            }
            return new EmbeddingOutcome(vectors, 0, null);
        } catch (KnowledgeEngineException e) {
            log.warn("ingest.embed.batch.failed documentId={} firstChunk={} size={} reason={}",
                    documentId, batch.get(0).sequenceIndex(), batch.size(), e.getMessage());
        }

        int failed = 0;
        String lastError = null;
        for (Chunk chunk : batch) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("embedding cancelled for document " + documentId);
            }
            String error = null;
            for (int attempt = 1; attempt <= settings.chunkRetryLimit(); attempt++) {
                try {
                    vectors.put(chunk.sequenceIndex(), provider.embed(List.of(chunk.text())).get(0));
                    error = null;
                    break;
                } catch (KnowledgeEngineException e) {
                    error = e.getMessage();
                    log.debug("ingest.embed.chunk.retry chunkId={} attempt={} reason={}", chunk.id(), attempt, error);
                }
            }
            if (error != null || !vectors.containsKey(chunk.sequenceIndex())) {
                failed++;
                lastError = error;
                log.warn("ingest.embed.chunk.failed chunkId={} reason={}", chunk.id(), error);
            }
        }
        return new EmbeddingOutcome(vectors, failed, lastError);
    }

    private boolean deleteQuietly(String documentId, String namespace, List<String> ids) {
        if (ids.isEmpty()) {
            return true;
        }
        try {
            vectorStore.delete(namespace, ids);
            log.info("ingest.superseded.deleted documentId={} records={}", documentId, ids.size());
            return true;
        } catch (KnowledgeEngineException e) {
            log.warn("ingest.superseded.failed documentId={} records={} reason={}", documentId, ids.size(), e.getMessage());
            return false;
        }
    }

    private IngestionReport fail(Document document, String reason, int embeddedChunks, int failedChunks,
            int upsertedBatches, int skippedBatches) {
        document.transition(DocumentStatus.FAILED, reason, clock.millis());
        notifyListener(document);
        DocumentState state = document.state();
        log.warn("ingest.failed documentId={} reason={}", document.id(), reason);
        return new IngestionReport(document.id(), DocumentStatus.FAILED, state.chunkCount(), embeddedChunks, failedChunks,
                upsertedBatches, skippedBatches, reason);
    }

    private void notifyListener(Document document) {
        DocumentState state = document.state();
        try {
            listener.onStatusChange(document.id(), state.status(), state.lastError());
        } catch (RuntimeException e) {
            log.warn("ingest.listener.failed documentId={} status={}", document.id(), state.status(), e);
        }
    }

    private VectorRecord toRecord(Document document, String namespace, Chunk chunk, float[] vector) {
        RecordMetadata metadata = new RecordMetadata(
                document.id(),
                document.ownerScope().toString(),
                document.sourceLabel(),
                chunk.sequenceIndex(),
                chunk.startOffset(),
                chunk.endOffset(),
                chunk.text());
        return new VectorRecord(chunk.id(), vector, namespace, metadata);
    }

    private int batchCount(int chunkCount) {
        return (chunkCount + settings.upsertBatchSize() - 1) / settings.upsertBatchSize();
    }

    private List<Chunk> batchOf(List<Chunk> chunks, int batch) {
        int start = batch * settings.upsertBatchSize();
        return chunks.subList(start, Math.min(chunks.size(), start + settings.upsertBatchSize()));
    }

    private static List<String> recordIds(String documentId, int fromInclusive, int toExclusive) {
        return IntStream.range(fromInclusive, toExclusive)
                .mapToObj(index -> Chunk.chunkId(documentId, index))
                .toList();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        documentExecutor.shutdown();
        embeddingExecutor.shutdown();
        try {
            if (!documentExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                documentExecutor.shutdownNow();
            }
            if (!embeddingExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                embeddingExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            documentExecutor.shutdownNow();
            embeddingExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record EmbeddingOutcome(Map<Integer, float[]> vectors, int failed, String lastError) {
    }

    public record Settings(
            int upsertBatchSize,
            int embeddingBatchSize,
            long interBatchDelayMs,
            int chunkRetryLimit,
            int concurrentDocuments,
            int embeddingWorkers) {

        public Settings {
            if (upsertBatchSize <= 0 || embeddingBatchSize <= 0) {
                throw new ValidationException("batch sizes must be > 0");
            }
            if (interBatchDelayMs < 0) {
                throw new ValidationException("interBatchDelayMs must be >= 0");
            }
            if (chunkRetryLimit < 0) {
                throw new ValidationException("chunkRetryLimit must be >= 0");
            }
            if (concurrentDocuments <= 0 || embeddingWorkers <= 0) {
                throw new ValidationException("worker counts must be > 0");
            }
        }

        public static Settings from(AppConfig config) {
            return new Settings(
                    config.getIngestion().getUpsertBatchSize(),
                    config.getEmbedding().getBatchSize(),
                    config.getIngestion().getInterBatchDelayMs(),
                    config.getEmbedding().getChunkRetryLimit(),
                    config.getIngestion().getConcurrentDocuments(),
                    config.getEmbedding().getWorkerThreads());
        }
    }
}
