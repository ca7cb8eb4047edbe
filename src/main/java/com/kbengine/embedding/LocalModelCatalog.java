package com.kbengine.embedding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalModelCatalog {
    private static final Logger log = LoggerFactory.getLogger(LocalModelCatalog.class);
    private static final String MODEL_DIR_PREFIX = "models--";
    private static final Set<String> MODEL_FILES = Set.of(
            "config.json",
            "model.safetensors",
            "model.bin",
            "pytorch_model.bin",
            "model.onnx",
            "tokenizer_config.json");
    private static final Set<String> WEIGHT_FILES = Set.of(
            "model.safetensors",
            "model.bin",
            "pytorch_model.bin",
            "model.onnx");

    private final Path cacheDir;

    public LocalModelCatalog(Path cacheDir) {
        this.cacheDir = cacheDir;
    }

    public static Path defaultCacheDir() {
        return Path.of(System.getProperty("user.home"), ".cache", "huggingface", "hub");
    }

    public List<LocalModel> discover() {
        if (cacheDir == null || !Files.isDirectory(cacheDir)) {
            log.debug("models.cache.missing dir={}", cacheDir);
            return List.of();
        }
        List<LocalModel> models = new ArrayList<>();
        try (Stream<Path> entries = Files.list(cacheDir)) {
            for (Path entry : entries.sorted().toList()) {
                String dirName = entry.getFileName().toString();
                if (!Files.isDirectory(entry) || !dirName.startsWith(MODEL_DIR_PREFIX)) {
                    continue;
                }
                String modelId = dirName.substring(MODEL_DIR_PREFIX.length()).replace("--", "/");
                List<String> files = fileNames(entry);
                if (files.stream().noneMatch(MODEL_FILES::contains)) {
                    continue;
                }
                boolean hasWeights = files.stream().anyMatch(WEIGHT_FILES::contains);
                models.add(new LocalModel(modelId, entry, directorySize(entry), dimensionsFor(modelId), hasWeights));
            }
        } catch (IOException e) {
            log.warn("models.cache.unreadable dir={} reason={}", cacheDir, e.getMessage());
            return List.of();
        }
        models.sort(Comparator.comparing(LocalModel::id));
        return models;
    }

    public Optional<LocalModel> find(String modelId) {
        return discover().stream().filter(model -> model.id().equalsIgnoreCase(modelId)).findFirst();
    }

    static int dimensionsFor(String modelId) {
        String lower = modelId.toLowerCase(Locale.ROOT);
        if (lower.contains("minilm") || lower.contains("e5-small") || lower.contains("bge-small")) {
            return 384;
        }
        if (lower.contains("large")) {
            return 1024;
        }
        return 768;
    }

    private static List<String> fileNames(Path modelDir) throws IOException {
        try (Stream<Path> walk = Files.walk(modelDir)) {
            return walk.filter(path -> Files.isRegularFile(path) || Files.isSymbolicLink(path))
                    .map(path -> path.getFileName().toString())
                    .toList();
        }
    }

    private static long directorySize(Path modelDir) throws IOException {
        try (Stream<Path> walk = Files.walk(modelDir)) {
            return walk.filter(Files::isRegularFile).mapToLong(path -> {
                try {
                    return Files.size(path);
                } catch (IOException e) {
                    return 0L;
                }
            }).sum();
        }
    }
}
