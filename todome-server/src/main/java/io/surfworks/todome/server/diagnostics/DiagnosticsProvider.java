package io.surfworks.todome.server.diagnostics;

import io.surfworks.todome.diagnostics.DueDateAdvisor;
import io.surfworks.todome.diagnostics.DueNotice;
import io.surfworks.todome.incremental.DocumentState;
import io.surfworks.todome.server.protocol.Diagnostic;
import io.surfworks.todome.server.protocol.DiagnosticSeverity;
import io.surfworks.todome.server.protocol.Range;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns due-date notices into editor diagnostics spanning the task's line.
 */
public final class DiagnosticsProvider {

    private final String source;
    private final DueDateAdvisor advisor;

    public DiagnosticsProvider(String source, int dueSoonDays) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.advisor = new DueDateAdvisor(dueSoonDays);
    }

    public List<Diagnostic> diagnostics(DocumentState state, LocalDate today) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (DueNotice notice : advisor.advise(state.resolution(), today)) {
            String text = state.forest().lines().get(notice.line()).text();
            Range range = Range.onLine(notice.line(), indentation(text), text.length());
            diagnostics.add(new Diagnostic(range, severity(notice.kind()), source, notice.message()));
        }
        return diagnostics;
    }

    static DiagnosticSeverity severity(DueNotice.Kind kind) {
        return switch (kind) {
            case OVERDUE -> DiagnosticSeverity.ERROR;
            case DUE_TODAY -> DiagnosticSeverity.WARNING;
            case DUE_SOON -> DiagnosticSeverity.INFORMATION;
        };
    }

    private static int indentation(String text) {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == '\t' || text.charAt(i) == ' ')) {
            i++;
        }
        return i;
    }
}
