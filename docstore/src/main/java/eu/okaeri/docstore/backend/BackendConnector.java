package eu.okaeri.docstore.backend;

import eu.okaeri.docstore.exception.BackendUnavailableException;
import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

/**
 * Connects a backend factory within a fixed deadline.
 * <p>
 * Every attempt receives the time left until the deadline as its budget,
 * so a single slow attempt cannot outlive the deadline. Failed attempts are
 * retried after a short pause, a tenth of the timeout capped at 500ms.
 * A zero timeout makes exactly one attempt.
 */
@Getter
public final class BackendConnector {

    private static final Logger LOGGER = Logger.getLogger(BackendConnector.class.getSimpleName());

    private static final Duration MAX_RETRY_PAUSE = Duration.ofMillis(500);

    private final String contextName;
    private final BackendFactory factory;
    private final Duration timeout;
    private final Duration retryPause;

    public BackendConnector(@NonNull String contextName, @NonNull BackendFactory factory, @NonNull Duration timeout) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout cannot be negative");
        }
        this.contextName = contextName;
        this.factory = factory;
        this.timeout = timeout;
        Duration tenth = timeout.dividedBy(10);
        this.retryPause = (tenth.compareTo(MAX_RETRY_PAUSE) < 0) ? tenth : MAX_RETRY_PAUSE;
    }

    /**
     * @return the connected backend
     * @throws BackendUnavailableException when the deadline passes or the thread is interrupted
     */
    public StorageBackend connect() {
        Instant start = Instant.now();
        Instant deadline = start.plus(this.timeout);
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                return this.factory.create(remaining(deadline));
            } catch (RuntimeException exception) {
                Duration left = remaining(deadline);
                if (left.isZero()) {
                    throw this.unavailable(start, attempt, exception);
                }

                Duration pause = (this.retryPause.compareTo(left) < 0) ? this.retryPause : left;
                String cause = (exception.getCause() != null)
                    ? (" caused by " + exception.getCause().getMessage())
                    : "";
                LOGGER.severe("[" + this.contextName + "] Cannot connect (attempt " + attempt +
                    ", retrying in " + formatDuration(pause) + ", deadline in " +
                    formatDuration(left) + "): " + exception.getMessage() + cause);

                try {
                    Thread.sleep(pause.toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new BackendUnavailableException("Interrupted while connecting " + this.contextName, interrupted);
                }

                if (remaining(deadline).isZero()) {
                    throw this.unavailable(start, attempt, exception);
                }
            }
        }
    }

    private BackendUnavailableException unavailable(Instant start, int attempt, RuntimeException exception) {
        Duration elapsed = Duration.between(start, Instant.now());
        return new BackendUnavailableException(this.contextName + " unavailable after " + formatDuration(elapsed) +
            " (" + attempt + ((attempt == 1) ? " attempt" : " attempts") + "): " + exception.getMessage(), exception);
    }

    private static Duration remaining(Instant deadline) {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    static String formatDuration(Duration duration) {
        long millis = duration.toMillis();
        if (millis < 1000) {
            return millis + "ms";
        }
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        long minutes = seconds / 60;
        long remainingSeconds = seconds % 60;
        if (remainingSeconds == 0) {
            return minutes + "m";
        }
        return minutes + "m" + remainingSeconds + "s";
    }
}
