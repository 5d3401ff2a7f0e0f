package eu.okaeri.docstore.exception;

/**
 * Thrown when a filter, update or pipeline uses an operator outside
 * the portable grammar (equality map plus {@code $text}).
 */
public class UnsupportedQueryException extends DocumentStoreException {

    public UnsupportedQueryException(String message) {
        super(message);
    }
}
