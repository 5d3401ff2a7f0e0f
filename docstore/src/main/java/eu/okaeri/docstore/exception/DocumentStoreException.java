package eu.okaeri.docstore.exception;

/**
 * Base type for failures raised by the document store layer.
 * Lookup misses are never reported through exceptions.
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
