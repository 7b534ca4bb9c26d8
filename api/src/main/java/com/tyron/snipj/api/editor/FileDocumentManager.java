package com.tyron.snipj.api.editor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Manages mapping between files and in-memory {@link Document}s.
 *
 * Documents are edited in-memory and are only persisted to disk when explicitly committed.
 */
public interface FileDocumentManager {

    /**
     * Returns a cached in-memory document for the given file, loading it if necessary.
     */
    Document getDocument(Path file) throws IOException;

    /**
     * Returns the file associated with a document, or null if unknown.
     */
    Path getFile(Document document);

    /**
     * @return true if the document has uncommitted in-memory changes.
     */
    boolean isModified(Document document);

    /**
     * Writes the document content to disk.
     */
    void commitDocument(Document document) throws IOException;
}
