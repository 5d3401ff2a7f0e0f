package eu.okaeri.docstore.backend;

import eu.okaeri.docstore.exception.BackendUnavailableException;
import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * Chooses the backend once per store lifetime.
 * <p>
 * The primary backend is retried until it answers or the probe timeout passes
 * (see {@link BackendConnector}); when it stays unavailable the fallback
 * backend is used instead. Without a primary backend the fallback is used
 * directly.
 * <pre>{@code
 * BackendSelector selector = BackendSelector.builder()
 *     .primary(MongoBackend.factory(config))
 *     .fallback(() -> FlatFileBackend.fromConfig(config))
 *     .probeTimeout(config.getProbeTimeout())
 *     .build();
 * }</pre>
 */
@Getter
public class BackendSelector {

    private static final Logger LOGGER = Logger.getLogger(BackendSelector.class.getSimpleName());

    private final BackendFactory primary;
    private final BackendFactory fallback;
    private final Duration probeTimeout;

    private BackendSelector(BackendFactory primary, @NonNull BackendFactory fallback, @NonNull Duration probeTimeout) {
        this.primary = primary;
        this.fallback = fallback;
        this.probeTimeout = probeTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BackendSelector of(@NonNull BackendFactory backend) {
        return builder().fallback(backend).build();
    }

    public StorageBackend select() {
        if (this.primary == null) {
            StorageBackend backend = this.fallback.create();
            LOGGER.info("No primary storage configured, using " + backend.getName());
            return backend;
        }

        try {
            StorageBackend backend = new BackendConnector("primary storage", this.primary, this.probeTimeout).connect();
            LOGGER.info("Connected to " + backend.getName());
            return backend;
        } catch (BackendUnavailableException exception) {
            StorageBackend backend = this.fallback.create();
            LOGGER.warning("Primary storage unavailable (" + exception.getMessage() + "), falling back to " + backend.getName());
            return backend;
        }
    }

    public static final class Builder {

        private BackendFactory primary;
        private BackendFactory fallback;
        private Duration probeTimeout = Duration.ofSeconds(10);

        private Builder() {
        }

        public Builder primary(BackendFactory primary) {
            this.primary = primary;
            return this;
        }

        public Builder fallback(@NonNull BackendFactory fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder probeTimeout(@NonNull Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public BackendSelector build() {
            if (this.fallback == null) {
                throw new IllegalStateException("fallback is required");
            }
            return new BackendSelector(this.primary, this.fallback, this.probeTimeout);
        }
    }
}
