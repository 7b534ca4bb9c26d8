package com.tyron.snipj.core.editor;

import com.tyron.snipj.api.editor.Document;
import com.tyron.snipj.api.editor.FileDocumentManager;
import com.tyron.snipj.api.project.Project;
import com.tyron.snipj.core.editor.document.InMemoryDocument;
import com.tyron.snipj.core.service.ProjectServiceManager;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Core implementation of {@link FileDocumentManager}.
 *
 * Responsibilities:
 * - Cache file text as {@link Document} instances
 * - Track modified state
 * - Commit changes to disk only when requested
 */
public final class FileDocumentManagerImpl implements FileDocumentManager {

    public static FileDocumentManagerImpl getInstance(Project project) {
        return (FileDocumentManagerImpl) ProjectServiceManager.getService(project, FileDocumentManager.class);
    }

    private final Map<Path, InMemoryDocument> byPath = new HashMap<>();
    private final Map<Document, Path> byDocument = new IdentityHashMap<>();
    private final Map<Document, Boolean> modified = new IdentityHashMap<>();

    private final Object lock = new Object();

    public FileDocumentManagerImpl(Project project) {
        Objects.requireNonNull(project, "project");
    }

    @Override
    public Document getDocument(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path path = file.toAbsolutePath().normalize();

        synchronized (lock) {
            InMemoryDocument existing = byPath.get(path);
            if (existing != null) {
                return existing;
            }
        }

        // Load from disk once.
        String initialText = Files.readString(path, StandardCharsets.UTF_8);
        InMemoryDocument doc = new InMemoryDocument(initialText);
        doc.addDocumentListener(event -> {
            synchronized (lock) {
                modified.put(doc, Boolean.TRUE);
            }
        });

        synchronized (lock) {
            InMemoryDocument raced = byPath.get(path);
            if (raced != null) {
                return raced;
            }
            byPath.put(path, doc);
            byDocument.put(doc, path);
            modified.put(doc, Boolean.FALSE);
        }
        return doc;
    }

    @Override
    public Path getFile(Document document) {
        Objects.requireNonNull(document, "document");
        synchronized (lock) {
            return byDocument.get(document);
        }
    }

    @Override
    public boolean isModified(Document document) {
        Objects.requireNonNull(document, "document");
        synchronized (lock) {
            return Boolean.TRUE.equals(modified.get(document));
        }
    }

    @Override
    public void commitDocument(Document document) throws IOException {
        Objects.requireNonNull(document, "document");

        Path path = getFile(document);
        if (path == null || !isModified(document)) {
            return;
        }

        Files.writeString(path, document.getText(), StandardCharsets.UTF_8);

        synchronized (lock) {
            modified.put(document, Boolean.FALSE);
        }
    }
}
