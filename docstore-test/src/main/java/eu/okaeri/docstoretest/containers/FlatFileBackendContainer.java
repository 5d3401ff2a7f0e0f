package eu.okaeri.docstoretest.containers;

import eu.okaeri.docstore.backend.BackendSelector;
import eu.okaeri.docstore.backend.DocumentStore;
import eu.okaeri.docstore.flat.FlatFileBackend;
import lombok.Cleanup;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Flat file backend container using a temporary directory.
 */
public class FlatFileBackendContainer implements BackendContainer {

    private Path tempDir;

    public Path getTempDir() {
        return this.tempDir;
    }

    @Override
    public String getName() {
        return "Flat Files";
    }

    @Override
    public DocumentStore createStore() {
        try {
            this.tempDir = Files.createTempDirectory("okaeri-docstore-test-");
        } catch (IOException exception) {
            throw new UncheckedIOException("Failed to create temp directory for flat file storage", exception);
        }

        Path storageDir = this.tempDir;
        return new DocumentStore(BackendSelector.of(() -> FlatFileBackend.builder()
            .storageDir(storageDir)
            .build()));
    }

    @Override
    public boolean requiresContainer() {
        return false;
    }

    @Override
    public BackendType getType() {
        return BackendType.FLAT_FILE;
    }

    @Override
    public void close() throws Exception {
        if ((this.tempDir != null) && Files.exists(this.tempDir)) {
            @Cleanup Stream<Path> walk = Files.walk(this.tempDir);
            walk
                .sorted(Comparator.reverseOrder())
                .map(Path::toFile)
                .forEach(File::delete);
        }
    }

    @Override
    public String toString() {
        return this.getName();
    }
}
