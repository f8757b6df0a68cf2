package io.github.nicechester.commentariat.store;

/**
 * Failure of the underlying storage (I/O, SQL). Not caused by the data being stored.
 */
public class EntryStoreException extends RuntimeException {

    public EntryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
