package eu.okaeri.docstore.exception;

import java.io.IOException;

/**
 * Thrown when a collection file cannot be read, parsed or written.
 */
public class StorageIOException extends DocumentStoreException {

    public StorageIOException(String message, IOException cause) {
        super(message, cause);
    }

    public StorageIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
