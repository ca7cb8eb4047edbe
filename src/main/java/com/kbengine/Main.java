package com.kbengine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.kbengine.chunking.Chunker;
import com.kbengine.embedding.EmbeddingProvider;
import com.kbengine.embedding.EmbeddingProviders;
import com.kbengine.embedding.LocalModel;
import com.kbengine.embedding.LocalModelCatalog;
import com.kbengine.embedding.ProviderDescription;
import com.kbengine.error.KnowledgeEngineException;
import com.kbengine.ingest.Document;
import com.kbengine.ingest.DocumentRegistry;
import com.kbengine.ingest.DocumentState;
import com.kbengine.ingest.DocumentStatus;
import com.kbengine.ingest.FileSystemContentStore;
import com.kbengine.ingest.IngestionPipeline;
import com.kbengine.ingest.IngestionReport;
import com.kbengine.resilience.Sleeper;
import com.kbengine.retrieval.KnowledgeSourceRouter;
import com.kbengine.retrieval.OwnScopeEntitlements;
import com.kbengine.retrieval.Principal;
import com.kbengine.retrieval.RetrievalEngine;
import com.kbengine.retrieval.RetrievalResponse;
import com.kbengine.retrieval.SearchMode;
import com.kbengine.runtime.AcceleratorProbe;
import com.kbengine.runtime.AppConfig;
import com.kbengine.vector.InMemoryVectorStore;
import com.kbengine.vector.Namespaces;
import com.kbengine.vector.OwnerScope;
import com.kbengine.vector.RetrievalResult;
import com.kbengine.vector.VectorStoreClient;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "kb-engine",
        mixinStandardHelpOptions = true,
        version = "kb-engine 0.1.0",
        description = "Ingests documents into a vector index and retrieves knowledge across sources.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = "--content-root", description = "Directory document references are resolved against", defaultValue = ".")
    Path contentRoot;

    @Option(names = "--index-path", description = "Path for local vector index JSON", defaultValue = ".kbengine/vector-index.json")
    Path indexPath;

    @Option(names = "--registry-path", description = "Path for document registry JSON", defaultValue = ".kbengine/documents.json")
    Path registryPath;

    @Option(names = "--document", description = "Content reference of the document to ingest, relative to --content-root")
    String document;

    @Option(names = "--document-id", description = "Document id (defaults to the content reference)")
    String documentId;

    @Option(names = "--source-label", description = "Label shown when the document is cited")
    String sourceLabel;

    @Option(names = "--owner-scope", description = "Document owner: system, tenant:<id> or user:<id>", defaultValue = "system")
    String ownerScope;

    @Option(names = "--query", description = "Query text used in retrieve mode")
    String query;

    @Option(names = "--search-mode", description = "Knowledge sources to search: system, user or hybrid", defaultValue = "hybrid")
    String searchMode;

    @Option(names = "--user", description = "User id the retrieval runs for", defaultValue = "local-user")
    String userId;

    @Option(names = "--tenant", description = "Tenant id of the user, if any")
    String tenantId;

    @Option(names = "--top-k", description = "Top results to return (0 uses retrieval.defaultTopK)", defaultValue = "0")
    int topK;

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        ingest,
        retrieve,
        models,
        status,
        purge
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting kb-engine in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try {
            return switch (mode) {
                case ingest -> runIngest(config);
                case retrieve -> runRetrieve(config);
                case models -> runModels(config);
                case status -> runStatus();
                case purge -> runPurge(config);
            };
        } catch (KnowledgeEngineException e) {
            log.error("{} failed kind={} reason={}", mode, e.kind(), e.getMessage());
            return 1;
        }
    }

    private int runIngest(AppConfig config) throws IOException {
        if (document == null || document.isBlank()) {
            log.error("--document is required in ingest mode");
            return 2;
        }
        String id = documentId == null || documentId.isBlank() ? document : documentId;
        InMemoryVectorStore store = InMemoryVectorStore.load(indexPath);
        DocumentRegistry registry = DocumentRegistry.load(registryPath, System.currentTimeMillis());
        IngestionReport report;
        try (IngestionPipeline pipeline = newPipeline(config, store, registry)) {
            Document registered = pipeline.register(id, OwnerScope.parse(ownerScope), document, sourceLabel);
            if (registered.status() != DocumentStatus.PENDING) {
                pipeline.requestReingest(id);
            }
            report = pipeline.ingest(id);
        } finally {
            store.save(indexPath);
            registry.save(registryPath);
        }
        log.info("Ingested document id={} status={} chunks={} upsertedBatches={} skippedBatches={} error={}",
                report.documentId(),
                report.status(),
                report.chunkCount(),
                report.upsertedBatches(),
                report.skippedBatches(),
                report.lastError() == null ? "none" : report.lastError());
        return report.status() == DocumentStatus.INDEXED ? 0 : 1;
    }

    private int runRetrieve(AppConfig config) throws IOException {
        if (query == null || query.isBlank()) {
            log.error("--query is required in retrieve mode");
            return 2;
        }
        InMemoryVectorStore store = InMemoryVectorStore.load(indexPath);
        Namespaces namespaces = new Namespaces(config.getVectorStore().getNamespacePrefix());
        EmbeddingProvider provider = EmbeddingProviders.fromConfig(config.getEmbedding(), httpClient);
        VectorStoreClient client = VectorStoreClient.fromConfig(store, config.getVectorStore(),
                config.getRetrieval().getSnippetLength(), Clock.systemUTC(), Sleeper.THREAD);
        KnowledgeSourceRouter router = new KnowledgeSourceRouter(namespaces, new OwnScopeEntitlements(namespaces));
        RetrievalEngine.Settings settings = RetrievalEngine.Settings.from(config.getRetrieval());
        int k = topK > 0 ? topK : settings.defaultTopK();

        RetrievalResponse response;
        try (RetrievalEngine engine = new RetrievalEngine(router, provider, client, namespaces, settings)) {
            response = engine.retrieve(new Principal(userId, tenantId), query, SearchMode.parse(searchMode), k);
        }
        if (response.noContext()) {
            log.info("No context found for query namespaces={} omitted={}",
                    response.searchedNamespaces(), response.omittedNamespaces());
            return 0;
        }
        List<RetrievalResult> results = response.results();
        for (int i = 0; i < results.size(); i++) {
            RetrievalResult result = results.get(i);
            log.info("Result #{} score={} namespace={} source={} chunk={} citation={}",
                    i + 1,
                    String.format("%.4f", result.score()),
                    result.namespace(),
                    result.sourceLabel(),
                    result.chunkId(),
                    result.snippet());
        }
        if (response.partial()) {
            log.warn("Partial results, omitted namespaces: {}", response.omittedNamespaces());
        }
        return 0;
    }

    private int runModels(AppConfig config) {
        AcceleratorProbe.CapabilityReport report = new AcceleratorProbe().probe();
        log.info("Accelerators best={} devices={}", report.bestDevice(), report.devices());

        String cacheDir = config.getEmbedding().getModelCacheDir();
        LocalModelCatalog catalog = new LocalModelCatalog(cacheDir == null || cacheDir.isBlank()
                ? LocalModelCatalog.defaultCacheDir()
                : Path.of(cacheDir));
        List<LocalModel> models = catalog.discover();
        if (models.isEmpty()) {
            log.info("No cached models found");
        }
        for (LocalModel model : models) {
            log.info("Model id={} dimensionality={} sizeBytes={} available={} path={}",
                    model.id(), model.dimensionality(), model.sizeBytes(), model.available(), model.path());
        }

        ProviderDescription description = EmbeddingProviders.fromConfig(config.getEmbedding(), httpClient).describe();
        log.info("Configured provider name={} device={} available={}",
                description.name(), description.device(), description.available());
        return 0;
    }

    private int runStatus() throws IOException {
        DocumentRegistry registry = DocumentRegistry.load(registryPath, System.currentTimeMillis());
        if (registry.all().isEmpty()) {
            log.info("No documents registered in {}", registryPath);
        }
        for (Document doc : registry.all()) {
            DocumentState state = doc.state();
            log.info("Document id={} owner={} status={} chunks={} upsertedBatches={} error={}",
                    doc.id(),
                    doc.ownerScope(),
                    state.status(),
                    state.chunkCount(),
                    state.upsertedBatches(),
                    state.lastError() == null ? "none" : state.lastError());
        }
        return 0;
    }

    private int runPurge(AppConfig config) throws IOException {
        if (documentId == null || documentId.isBlank()) {
            log.error("--document-id is required in purge mode");
            return 2;
        }
        InMemoryVectorStore store = InMemoryVectorStore.load(indexPath);
        DocumentRegistry registry = DocumentRegistry.load(registryPath, System.currentTimeMillis());
        int removed;
        try (IngestionPipeline pipeline = newPipeline(config, store, registry)) {
            removed = pipeline.purge(documentId);
        }
        store.save(indexPath);
        registry.save(registryPath);
        log.info("Purged document id={} records={}", documentId, removed);
        return 0;
    }

    private IngestionPipeline newPipeline(AppConfig config, InMemoryVectorStore store, DocumentRegistry registry) {
        AppConfig.ChunkingConfig chunking = config.getChunking();
        Namespaces namespaces = new Namespaces(config.getVectorStore().getNamespacePrefix());
        VectorStoreClient client = VectorStoreClient.fromConfig(store, config.getVectorStore(),
                config.getRetrieval().getSnippetLength(), Clock.systemUTC(), Sleeper.THREAD);
        return new IngestionPipeline(
                new Chunker(chunking.getMaxChunkSize(), chunking.getOverlap(), chunking.getLookback()),
                EmbeddingProviders.fromConfig(config.getEmbedding(), httpClient),
                client,
                namespaces,
                new FileSystemContentStore(contentRoot),
                registry,
                IngestionPipeline.Settings.from(config),
                (id, status, error) -> log.info("ingest.status documentId={} status={}", id, status));
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
