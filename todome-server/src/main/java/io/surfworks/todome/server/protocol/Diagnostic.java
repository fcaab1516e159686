package io.surfworks.todome.server.protocol;

import java.util.Objects;

/**
 * A message attached to a range of a document.
 */
public record Diagnostic(Range range, DiagnosticSeverity severity, String source, String message) {

    public Diagnostic {
        Objects.requireNonNull(range, "range cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }
}
