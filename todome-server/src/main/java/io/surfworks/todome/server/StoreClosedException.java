package io.surfworks.todome.server;

/**
 * Thrown when work is submitted to a document store that has been closed.
 */
public class StoreClosedException extends IllegalStateException {

    public StoreClosedException() {
        super("Document store is closed");
    }
}
