package uk.gegc.dolos.features.generation.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.dolos.shared.config.DolosProperties;
import uk.gegc.dolos.shared.exception.DocumentNotFoundException;
import uk.gegc.dolos.shared.exception.DocumentStorageException;
import uk.gegc.dolos.shared.exception.InputValidationException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Generated packages on local disk, one file per document filename under {@code dolos.storage-dir}.
 * A write either replaces the destination with the complete package or leaves it untouched.
 */
@Component
@Slf4j
public class DocumentFileStore {

    private final Path baseDir;

    public DocumentFileStore(DolosProperties properties) {
        this.baseDir = Paths.get(properties.getStorageDir()).toAbsolutePath().normalize();
    }

    public void write(String filename, byte[] content) {
        Path output = resolve(filename);
        Path tmp = null;
        try {
            Files.createDirectories(baseDir);
            tmp = Files.createTempFile(baseDir, output.getFileName().toString(), ".tmp");
            Files.write(tmp, content);
            try {
                Files.move(tmp, output, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {} bytes to {}", content.length, output);
        } catch (IOException e) {
            safeDelete(tmp);
            throw new DocumentStorageException("Failed to store document " + filename + ": " + e.getMessage(), e);
        }
    }

    public byte[] read(String filename) {
        Path path = resolve(filename);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new DocumentNotFoundException("No stored package for document: " + filename);
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to read document " + filename + ": " + e.getMessage(), e);
        }
    }

    public boolean exists(String filename) {
        return Files.isRegularFile(resolve(filename));
    }

    public boolean delete(String filename) {
        try {
            return Files.deleteIfExists(resolve(filename));
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to delete document " + filename + ": " + e.getMessage(), e);
        }
    }

    /**
     * Maps a document filename onto the storage directory. Names that would escape it are rejected.
     */
    public Path resolve(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new InputValidationException("Filename is required");
        }
        Path resolved = baseDir.resolve(filename).normalize();
        if (!baseDir.equals(resolved.getParent())) {
            throw new InputValidationException("Filename must not contain path segments: " + filename);
        }
        return resolved;
    }

    private void safeDelete(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }
}
