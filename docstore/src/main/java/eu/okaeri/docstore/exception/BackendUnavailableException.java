package eu.okaeri.docstore.exception;

/**
 * Thrown when the network backend cannot be reached within the probe window.
 * Backend selection reacts to it by falling back to the file backend.
 */
public class BackendUnavailableException extends DocumentStoreException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
