package io.surfworks.todome.server;

/**
 * Thrown when an operation names a document that is not open in the store.
 */
public class DocumentNotOpenException extends RuntimeException {

    private final String uri;

    public DocumentNotOpenException(String uri) {
        super("Document is not open: " + uri);
        this.uri = uri;
    }

    public String uri() {
        return uri;
    }
}
