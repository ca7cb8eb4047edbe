package com.kbengine.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.kbengine.chunking.Chunker;
import com.kbengine.embedding.EmbeddingProvider;
import com.kbengine.embedding.ProviderDescription;
import com.kbengine.error.NotFoundException;
import com.kbengine.error.ProviderException;
import com.kbengine.error.ValidationException;
import com.kbengine.resilience.CircuitBreaker;
import com.kbengine.resilience.RetryPolicy;
import com.kbengine.vector.InMemoryVectorStore;
import com.kbengine.vector.Namespaces;
import com.kbengine.vector.OwnerScope;
import com.kbengine.vector.VectorMatch;
import com.kbengine.vector.VectorRecord;
import com.kbengine.vector.VectorStore;
import com.kbengine.vector.VectorStoreClient;

class IngestionPipelineTest {
    private static final int DIMENSIONS = 8;
    private static final String SYSTEM_NS = "test-system-kb";

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC);
    private final MapContentStore content = new MapContentStore();
    private final FlakyStore store = new FlakyStore();
    private final DocumentRegistry registry = new DocumentRegistry();
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();
    private final List<String> events = new CopyOnWriteArrayList<>();
    private final List<IngestionPipeline> pipelines = new ArrayList<>();

    @AfterEach
    void closePipelines() {
        pipelines.forEach(IngestionPipeline::close);
    }

    @Test
    void shouldIndexDocumentAndReportEachStatus() {
        StubProvider provider = new StubProvider();
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), provider,
                (id, status, error) -> events.add(id + ":" + status));
        content.put("guide.md", text(420));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");

        IngestionReport report = pipeline.ingest("guide");

        assertEquals(DocumentStatus.INDEXED, report.status());
        assertEquals(5, report.chunkCount());
        assertEquals(3, report.upsertedBatches());
        assertEquals(List.of("guide:CHUNKING", "guide:EMBEDDING", "guide:INDEXED"), events);
        assertEquals(List.of("guide#0", "guide#1", "guide#2", "guide#3", "guide#4"), store.delegate.ids(SYSTEM_NS));
        assertEquals(List.of(50L, 50L), sleeps);
        Document document = registry.get("guide");
        assertEquals(5, document.state().chunkCount());
        assertEquals(3, document.state().upsertedBatches());
    }

    @Test
    void shouldWriteToNamespaceOfOwner() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), DocumentStatusListener.NONE);
        content.put("notes.md", text(150));
        pipeline.register("notes", OwnerScope.user("alice"), "notes.md", "Notes");

        pipeline.ingest("notes");

        assertEquals(2, store.delegate.size("test-user-alice"));
        assertEquals(0, store.delegate.size(SYSTEM_NS));
    }

    @Test
    void reingestingUnchangedDocumentShouldKeepRecordIds() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), DocumentStatusListener.NONE);
        content.put("guide.md", text(420));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");
        pipeline.ingest("guide");
        List<String> firstIds = store.delegate.ids(SYSTEM_NS);

        IngestionReport report = pipeline.reingest("guide");

        assertEquals(DocumentStatus.INDEXED, report.status());
        assertEquals(firstIds, store.delegate.ids(SYSTEM_NS));
    }

    @Test
    void shouldResumeAfterLastStoredBatch() {
        StubProvider provider = new StubProvider();
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), provider, DocumentStatusListener.NONE);
        content.put("guide.md", text(420));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");
        store.allowedUpserts = 1;

        IngestionReport failed = pipeline.ingest("guide");

        assertEquals(DocumentStatus.FAILED, failed.status());
        assertTrue(failed.lastError().contains("upsert of batch 1 failed"));
        assertEquals(1, registry.get("guide").state().upsertedBatches());
        assertEquals(List.of("guide#0", "guide#1"), store.delegate.ids(SYSTEM_NS));
        assertEquals(5, provider.embeddedTexts.get());

        store.allowedUpserts = Integer.MAX_VALUE;
        IngestionReport resumed = pipeline.reingest("guide");

        assertEquals(DocumentStatus.INDEXED, resumed.status());
        assertEquals(1, resumed.skippedBatches());
        assertEquals(2, resumed.upsertedBatches());
        assertEquals(8, provider.embeddedTexts.get());
        assertEquals(5, store.delegate.size(SYSTEM_NS));
    }

    @Test
    void shouldStartOverWhenContentChanged() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), DocumentStatusListener.NONE);
        content.put("guide.md", text(420));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");
        pipeline.ingest("guide");

        content.put("guide.md", text(180));
        IngestionReport report = pipeline.reingest("guide");

        assertEquals(0, report.skippedBatches());
        assertEquals(2, report.chunkCount());
        assertEquals(List.of("guide#0", "guide#1"), store.delegate.ids(SYSTEM_NS));
    }

    @Test
    void successfulReingestAfterFailedOneShouldDropOldVersionRecords() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), DocumentStatusListener.NONE);
        content.put("guide.md", text(900));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");
        assertEquals(11, pipeline.ingest("guide").chunkCount());

        content.put("guide.md", text(180));
        store.allowedUpserts = store.upsertCalls.get();
        IngestionReport failed = pipeline.reingest("guide");
        assertEquals(DocumentStatus.FAILED, failed.status());
        assertEquals(11, registry.get("guide").state().storedRecordLimit());

        store.allowedUpserts = Integer.MAX_VALUE;
        IngestionReport report = pipeline.reingest("guide");

        assertEquals(DocumentStatus.INDEXED, report.status());
        assertEquals(List.of("guide#0", "guide#1"), store.delegate.ids(SYSTEM_NS));
        assertEquals(2, registry.get("guide").state().storedRecordLimit());
    }

    @Test
    void purgeAfterFailedReingestShouldRemoveEveryVersion() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), DocumentStatusListener.NONE);
        content.put("guide.md", text(900));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");
        pipeline.ingest("guide");

        content.put("guide.md", text(180));
        store.allowedUpserts = store.upsertCalls.get();
        pipeline.reingest("guide");

        assertEquals(11, pipeline.purge("guide"));
        assertEquals(0, store.delegate.size(SYSTEM_NS));
        assertEquals(0, registry.get("guide").state().storedRecordLimit());
    }

    @Test
    void failureReportShouldCountBatchesOfThisRun() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), DocumentStatusListener.NONE);
        content.put("guide.md", text(580));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");
        store.allowedUpserts = 1;
        pipeline.ingest("guide");

        store.allowedUpserts = store.upsertCalls.get() + 1;
        IngestionReport report = pipeline.reingest("guide");

        assertEquals(DocumentStatus.FAILED, report.status());
        assertEquals(1, report.skippedBatches());
        assertEquals(1, report.upsertedBatches());
        assertEquals(2, registry.get("guide").state().upsertedBatches());
    }

    @Test
    void failedChunkEmbeddingsShouldNotBlockSiblings() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 0), new StubProvider(), DocumentStatusListener.NONE);
        content.put("mixed.md", "a".repeat(100) + "POISON" + "b".repeat(94) + "c".repeat(100));
        pipeline.register("mixed", OwnerScope.system(), "mixed.md", "Mixed");

        IngestionReport report = pipeline.ingest("mixed");

        assertEquals(DocumentStatus.FAILED, report.status());
        assertEquals(1, report.failedChunks());
        assertEquals(2, report.embeddedChunks());
        assertTrue(report.lastError().startsWith("1 of 3 chunks failed to embed"));
        assertEquals(List.of("mixed#0", "mixed#2"), store.delegate.ids(SYSTEM_NS));
        assertEquals(0, registry.get("mixed").state().upsertedBatches());
    }

    @Test
    void shouldFailDocumentsWithoutIndexableText() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), DocumentStatusListener.NONE);
        content.put("blank.md", "   \n\n   ");
        pipeline.register("blank", OwnerScope.system(), "blank.md", "Blank");
        pipeline.register("missing", OwnerScope.system(), "missing.md", "Missing");

        assertEquals("document has no indexable text", pipeline.ingest("blank").lastError());
        assertEquals(DocumentStatus.FAILED, pipeline.ingest("missing").status());
        assertTrue(registry.get("missing").state().lastError().contains("content not found"));
    }

    @Test
    void shouldOnlyIngestPendingDocuments() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), DocumentStatusListener.NONE);
        content.put("guide.md", text(120));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");
        pipeline.ingest("guide");

        assertThrows(ValidationException.class, () -> pipeline.ingest("guide"));
        assertThrows(NotFoundException.class, () -> pipeline.ingest("unknown"));
    }

    @Test
    void constructionShouldFailWithoutUsableProvider() {
        assertThrows(ValidationException.class,
                () -> pipeline(new Chunker(100, 20), null, DocumentStatusListener.NONE));
        StubProvider wrongSize = new StubProvider() {
            @Override
            public int dimensionality() {
                return 3;
            }
        };
        assertThrows(ValidationException.class,
                () -> pipeline(new Chunker(100, 20), wrongSize, DocumentStatusListener.NONE));
    }

    @Test
    void purgeShouldRemoveAllRecordsOfDocument() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), DocumentStatusListener.NONE);
        content.put("guide.md", text(420));
        content.put("other.md", text(120));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");
        pipeline.register("other", OwnerScope.system(), "other.md", "Other");
        pipeline.ingest("guide");
        pipeline.ingest("other");

        int removed = pipeline.purge("guide");

        assertEquals(5, removed);
        assertEquals(List.of("other#0", "other#1"), store.delegate.ids(SYSTEM_NS));
        assertEquals(0, registry.get("guide").state().chunkCount());
    }

    @Test
    void documentsShouldIngestConcurrently() throws Exception {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), DocumentStatusListener.NONE);
        for (int i = 0; i < 4; i++) {
            content.put("doc" + i + ".md", text(300 + i * 40));
            pipeline.register("doc" + i, OwnerScope.tenant("acme"), "doc" + i + ".md", "Doc " + i);
        }

        List<Future<IngestionReport>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(pipeline.submit("doc" + i));
        }

        for (Future<IngestionReport> future : futures) {
            assertEquals(DocumentStatus.INDEXED, future.get(10, TimeUnit.SECONDS).status());
        }
        assertTrue(store.delegate.size("test-tenant-acme") > 4);
    }

    @Test
    void cancellingIngestionShouldFailDocument() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        StubProvider blocking = new StubProvider() {
            @Override
            public List<float[]> embed(List<String> texts) {
                entered.countDown();
                try {
                    new CountDownLatch(1).await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ProviderException("stub", "interrupted", false, e);
                }
                return super.embed(texts);
            }
        };
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), blocking, DocumentStatusListener.NONE);
        content.put("guide.md", text(420));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");

        Future<IngestionReport> future = pipeline.submit("guide");
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        future.cancel(true);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (registry.get("guide").status() != DocumentStatus.FAILED && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(DocumentStatus.FAILED, registry.get("guide").status());
        assertEquals("ingestion cancelled", registry.get("guide").state().lastError());
        assertEquals(0, store.delegate.size(SYSTEM_NS));
    }

    @Test
    void failingListenerShouldNotBreakIngestion() {
        IngestionPipeline pipeline = pipeline(new Chunker(100, 20), new StubProvider(), (id, status, error) -> {
            throw new IllegalStateException("listener down");
        });
        content.put("guide.md", text(120));
        pipeline.register("guide", OwnerScope.system(), "guide.md", "Guide");

        assertEquals(DocumentStatus.INDEXED, pipeline.ingest("guide").status());
    }

    private IngestionPipeline pipeline(Chunker chunker, EmbeddingProvider provider, DocumentStatusListener listener) {
        IngestionPipeline pipeline = new IngestionPipeline(
                chunker,
                provider,
                client(),
                new Namespaces("test"),
                content,
                registry,
                new IngestionPipeline.Settings(2, 2, 50, 2, 2, 2),
                listener,
                clock,
                sleeps::add);
        pipelines.add(pipeline);
        return pipeline;
    }

    private VectorStoreClient client() {
        Map<VectorStoreClient.Operation, VectorStoreClient.Guard> guards = new EnumMap<>(VectorStoreClient.Operation.class);
        for (VectorStoreClient.Operation operation : VectorStoreClient.Operation.values()) {
            guards.put(operation, new VectorStoreClient.Guard(
                    new RetryPolicy(operation.label(), 1, 0, 0, 2.0, millis -> {
                    }),
                    new CircuitBreaker(operation.label(), 100, Duration.ofSeconds(60), clock)));
        }
        return new VectorStoreClient(store, DIMENSIONS, 240, guards);
    }

    private static String text(int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append((char) ('a' + i % 10));
        }
        return builder.toString();
    }

    private static class StubProvider implements EmbeddingProvider {
        final AtomicInteger embeddedTexts = new AtomicInteger();

        @Override
        public List<float[]> embed(List<String> texts) {
            if (texts.stream().anyMatch(text -> text.contains("POISON"))) {
                throw new ProviderException("stub", "poisoned input", false);
            }
            embeddedTexts.addAndGet(texts.size());
            return texts.stream().map(StubProvider::vectorFor).toList();
        }

        @Override
        public int dimensionality() {
            return DIMENSIONS;
        }

        @Override
        public ProviderDescription describe() {
            return new ProviderDescription("stub", "cpu", true);
        }

        private static float[] vectorFor(String text) {
            float[] vector = new float[DIMENSIONS];
            vector[Math.floorMod(text.hashCode(), DIMENSIONS)] = 1f;
            vector[0] += 0.1f;
            return vector;
        }
    }

    private static class MapContentStore implements ContentStore {
        private final Map<String, String> contents = new ConcurrentHashMap<>();

        void put(String contentRef, String text) {
            contents.put(contentRef, text);
        }

        @Override
        public String read(String contentRef) {
            String text = contents.get(contentRef);
            if (text == null) {
                throw new NotFoundException("content not found: " + contentRef);
            }
            return text;
        }
    }

    private static class FlakyStore implements VectorStore {
        private final InMemoryVectorStore delegate = new InMemoryVectorStore();
        private final AtomicInteger upsertCalls = new AtomicInteger();
        private volatile int allowedUpserts = Integer.MAX_VALUE;

        @Override
        public void upsert(String namespace, List<VectorRecord> records) throws IOException {
            if (upsertCalls.incrementAndGet() > allowedUpserts) {
                throw new IOException("vector database unavailable");
            }
            delegate.upsert(namespace, records);
        }

        @Override
        public List<VectorMatch> query(String namespace, float[] vector, int topK, Map<String, String> filter) {
            return delegate.query(namespace, vector, topK, filter);
        }

        @Override
        public void delete(String namespace, List<String> ids) {
            delegate.delete(namespace, ids);
        }
    }
}
