package com.kbengine.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.kbengine.error.NotFoundException;
import com.kbengine.error.ValidationException;

public class FileSystemContentStore implements ContentStore {
    private final Path root;

    public FileSystemContentStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String read(String contentRef) throws IOException {
        Path resolved = root.resolve(contentRef).normalize();
        if (!resolved.startsWith(root)) {
            throw new ValidationException("content reference escapes the content root: " + contentRef);
        }
        if (!Files.isRegularFile(resolved)) {
            throw new NotFoundException("content not found: " + contentRef);
        }
        return Files.readString(resolved, StandardCharsets.UTF_8);
    }
}
