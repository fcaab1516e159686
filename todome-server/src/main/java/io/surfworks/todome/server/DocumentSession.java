package io.surfworks.todome.server;

import io.surfworks.todome.incremental.DocumentState;
import io.surfworks.todome.incremental.IncrementalUpdateEngine;
import io.surfworks.todome.incremental.LineEdit;
import io.surfworks.todome.server.protocol.TextChange;

import java.util.Objects;

/**
 * Per-document state owned by one lane of the {@link DocumentStore}.
 *
 * <p>Only the owning lane calls the mutators. Readers on any thread get the
 * latest published snapshot, which is immutable and stays valid after newer
 * versions are published.
 */
public final class DocumentSession {

    private final String uri;
    private volatile Snapshot current;

    /**
     * A document state together with the number of edits applied since open.
     */
    public record Snapshot(String uri, long version, DocumentState state) {
    }

    DocumentSession(String uri, DocumentState initial) {
        this.uri = Objects.requireNonNull(uri, "uri cannot be null");
        this.current = new Snapshot(uri, 0, initial);
    }

    public String uri() {
        return uri;
    }

    public Snapshot snapshot() {
        return current;
    }

    Snapshot apply(LineEdit edit) {
        Snapshot previous = current;
        DocumentState next = IncrementalUpdateEngine.apply(previous.state(), edit);
        current = new Snapshot(uri, previous.version() + 1, next);
        return current;
    }

    Snapshot apply(TextChange change) {
        return apply(change.toLineEdit(current.state()));
    }
}
