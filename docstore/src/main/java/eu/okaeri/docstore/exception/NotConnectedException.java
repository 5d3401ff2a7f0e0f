package eu.okaeri.docstore.exception;

/**
 * Thrown when a store operation runs before a backend was selected
 * or after the store was closed.
 */
public class NotConnectedException extends DocumentStoreException {

    public NotConnectedException(String message) {
        super(message);
    }
}
