package com.bbthechange.tvguide.util;

import com.bbthechange.tvguide.exception.RepositoryException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A single JSON document on disk guarded by one exclusive lock, so a read and a write never interleave.
 *
 * Read problems (unreadable or malformed content) are logged and reported as an absent document.
 * Write problems are thrown as {@link RepositoryException}.
 *
 * @param <T> document type
 */
public class JsonFileStore<T> {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final TypeReference<T> documentType;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonFileStore(Path path, ObjectMapper objectMapper, TypeReference<T> documentType) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.documentType = documentType;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Read the document.
     *
     * @return the document, or empty when the file is missing, zero-length or cannot be parsed
     * @throws CancellationException if cancellation was requested before the read started
     */
    public Optional<T> read(CancellationSignal cancellation) {
        acquire(cancellation);
        try {
            cancellation.throwIfCancellationRequested();

            if (!Files.exists(path)) {
                logger.info("No data file at {}, starting empty", path);
                return Optional.empty();
            }
            if (Files.size(path) == 0) {
                logger.info("Data file {} is empty, starting empty", path);
                return Optional.empty();
            }

            try (InputStream in = Files.newInputStream(path)) {
                T document = objectMapper.readValue(in, documentType);
                logger.debug("Loaded data from {}", path);
                return Optional.ofNullable(document);
            }
        } catch (IOException e) {
            logger.error("Failed to load data from {}, treating it as empty", path, e);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the file content with the serialized document.
     *
     * @throws RepositoryException if the document could not be written
     * @throws CancellationException if cancellation was requested before the write started
     */
    public void write(T document, CancellationSignal cancellation) {
        acquire(cancellation);
        try {
            cancellation.throwIfCancellationRequested();

            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                objectMapper.writeValue(out, document);
            }
            replace(temp);

            logger.debug("Saved data to {}", path);
        } catch (IOException e) {
            throw new RepositoryException("Failed to save data to " + path, e);
        } finally {
            lock.unlock();
        }
    }

    private void replace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void acquire(CancellationSignal cancellation) {
        cancellation.throwIfCancellationRequested();
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for " + path);
        }
    }
}
