package io.surfworks.todome.server;

import io.surfworks.todome.format.FormatMode;
import io.surfworks.todome.format.TodomeFormatter;
import io.surfworks.todome.incremental.DocumentState;
import io.surfworks.todome.incremental.LineEdit;
import io.surfworks.todome.query.CandidateKind;
import io.surfworks.todome.server.DocumentSession.Snapshot;
import io.surfworks.todome.server.completion.CompletionProvider;
import io.surfworks.todome.server.config.ServerConfig;
import io.surfworks.todome.server.diagnostics.DiagnosticsProvider;
import io.surfworks.todome.server.protocol.CompletionItem;
import io.surfworks.todome.server.protocol.Diagnostic;
import io.surfworks.todome.server.protocol.Position;
import io.surfworks.todome.server.protocol.TextChange;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Open documents of one editor connection.
 *
 * <p>Documents are spread over a fixed number of single-threaded lanes by
 * their uri. Every open, change and close for a document runs on its lane, so
 * edits apply strictly in arrival order while different documents proceed in
 * parallel. Queries read the last published snapshot and never wait for a lane.
 */
public final class DocumentStore implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(DocumentStore.class.getName());

    private final ServerConfig config;
    private final ExecutorService[] lanes;
    private final Map<String, DocumentSession> sessions = new ConcurrentHashMap<>();
    private final CompletionProvider completion = new CompletionProvider();
    private final DiagnosticsProvider diagnostics;
    private volatile boolean closed;

    public DocumentStore() {
        this(ServerConfig.defaults());
    }

    public DocumentStore(ServerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.diagnostics = new DiagnosticsProvider(config.diagnosticSource(), config.dueSoonDays());
        this.lanes = new ExecutorService[config.laneCount()];
        for (int i = 0; i < lanes.length; i++) {
            String name = "todome-lane-" + i;
            lanes[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            });
        }
        LOG.info("Document store started with " + lanes.length + " lanes");
    }

    public ServerConfig config() {
        return config;
    }

    // ==================== Lifecycle ====================

    /**
     * Opens (or reopens) a document with its full text.
     */
    public CompletableFuture<Snapshot> open(String uri, String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return onLane(uri, () -> {
            DocumentSession session = new DocumentSession(uri, DocumentState.parse(text));
            if (sessions.put(uri, session) != null) {
                LOG.fine(() -> "Reopened " + uri);
            }
            return session.snapshot();
        });
    }

    public CompletableFuture<Snapshot> change(String uri, LineEdit edit) {
        Objects.requireNonNull(edit, "edit cannot be null");
        return onLane(uri, () -> session(uri).apply(edit));
    }

    /**
     * Applies editor content changes in order.
     */
    public CompletableFuture<Snapshot> change(String uri, List<TextChange> changes) {
        List<TextChange> copy = List.copyOf(changes);
        return onLane(uri, () -> {
            DocumentSession session = session(uri);
            Snapshot snapshot = session.snapshot();
            for (TextChange change : copy) {
                snapshot = session.apply(change);
            }
            return snapshot;
        });
    }

    /**
     * Disposes a document's session. Closing a document that is not open does nothing.
     */
    public CompletableFuture<Void> close(String uri) {
        return onLane(uri, () -> {
            if (sessions.remove(uri) != null) {
                LOG.fine(() -> "Closed " + uri);
            }
            return null;
        });
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        for (ExecutorService lane : lanes) {
            lane.shutdown();
        }
        try {
            for (ExecutorService lane : lanes) {
                if (!lane.awaitTermination(10, TimeUnit.SECONDS)) {
                    lane.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            for (ExecutorService lane : lanes) {
                lane.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }
        sessions.clear();
        LOG.info("Document store closed");
    }

    // ==================== Queries ====================

    /**
     * Latest published snapshot of a document.
     *
     * @throws DocumentNotOpenException if the document is not open
     */
    public Snapshot snapshot(String uri) {
        return session(uri).snapshot();
    }

    public Optional<Snapshot> find(String uri) {
        DocumentSession session = sessions.get(uri);
        return session == null ? Optional.empty() : Optional.of(session.snapshot());
    }

    public Set<String> openDocuments() {
        return Set.copyOf(sessions.keySet());
    }

    /**
     * Names of the given kind across every open document, sorted.
     */
    public List<String> candidates(CandidateKind kind, String prefix) {
        TreeSet<String> names = new TreeSet<>();
        for (DocumentSession session : sessions.values()) {
            names.addAll(session.snapshot().state().index().candidates(kind, prefix));
        }
        return List.copyOf(names);
    }

    public List<CompletionItem> completion(String uri, Position cursor, String trigger, LocalDate today) {
        return completion.complete(snapshot(uri).state(), cursor, trigger, today);
    }

    public List<Diagnostic> diagnostics(String uri, LocalDate today) {
        return diagnostics.diagnostics(snapshot(uri).state(), today);
    }

    public String format(String uri) {
        return format(uri, config.defaultFormatMode());
    }

    public String format(String uri, FormatMode mode) {
        return TodomeFormatter.format(snapshot(uri).state().forest(), mode);
    }

    // ==================== Internals ====================

    private DocumentSession session(String uri) {
        DocumentSession session = sessions.get(uri);
        if (session == null) {
            throw new DocumentNotOpenException(uri);
        }
        return session;
    }

    private <T> CompletableFuture<T> onLane(String uri, Supplier<T> work) {
        Objects.requireNonNull(uri, "uri cannot be null");
        if (closed) {
            throw new StoreClosedException();
        }
        ExecutorService lane = lanes[Math.floorMod(uri.hashCode(), lanes.length)];
        try {
            return CompletableFuture.supplyAsync(work, lane);
        } catch (RejectedExecutionException e) {
            throw new StoreClosedException();
        }
    }
}
