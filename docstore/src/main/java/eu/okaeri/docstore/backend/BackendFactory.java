package eu.okaeri.docstore.backend;

import lombok.NonNull;

import java.time.Duration;

/**
 * Creates a ready-to-use backend, connecting where the backend needs a connection.
 */
@FunctionalInterface
public interface BackendFactory {

    StorageBackend create();

    /**
     * Create the backend, spending at most about {@code budget} on connecting.
     * Factories without a connection step ignore the budget.
     *
     * @param budget time left for this attempt, never negative
     */
    default StorageBackend create(@NonNull Duration budget) {
        return this.create();
    }
}
