package eu.okaeri.docstoretest.containers;

import eu.okaeri.docstore.backend.DocumentStore;

/**
 * Abstraction for backend-specific test setup.
 * Every backend must pass the same end-to-end suite, that is the point
 * of the storage adapter.
 */
public interface BackendContainer extends AutoCloseable {

    /**
     * Display name for test output (e.g., "MongoDB 7", "Flat Files").
     * Used by JUnit for parameterized test display names.
     */
    String getName();

    /**
     * Create an unopened store for this backend. Called for each test.
     */
    DocumentStore createStore();

    /**
     * Whether this backend requires Docker testcontainers.
     */
    boolean requiresContainer();

    BackendType getType();

    /**
     * Cleanup resources (temp files, clients).
     */
    @Override
    void close() throws Exception;

    enum BackendType {
        MONGODB,
        FLAT_FILE
    }
}
