package io.surfworks.todome;

import io.surfworks.todome.diagnostics.OverdueDetector;
import io.surfworks.todome.diagnostics.OverdueDiagnostic;
import io.surfworks.todome.format.FormatMode;
import io.surfworks.todome.format.TodomeFormatter;
import io.surfworks.todome.incremental.DocumentState;
import io.surfworks.todome.incremental.IncrementalUpdateEngine;
import io.surfworks.todome.incremental.LineEdit;
import io.surfworks.todome.query.CandidateKind;
import io.surfworks.todome.query.QueryIndex;
import io.surfworks.todome.resolve.AttributeResolver;
import io.surfworks.todome.resolve.Resolution;
import io.surfworks.todome.syntax.Lines;
import io.surfworks.todome.tree.Forest;
import io.surfworks.todome.tree.TreeBuilder;

import java.time.LocalDate;
import java.util.List;

/**
 * Entry points for to-do documents.
 *
 * <p>Every function here is total: any string parses, malformed notation
 * degrades to body text, and no function reads the clock or touches files.
 *
 * <pre>{@code
 * Forest forest = Todome.parse(text);
 * Resolution resolution = Todome.resolve(forest);
 * List<OverdueDiagnostic> late = Todome.overdue(resolution, LocalDate.now());
 * String canonical = Todome.format(forest, FormatMode.NORMALIZED);
 * }</pre>
 */
public final class Todome {

    private Todome() {}

    public static Forest parse(String text) {
        return TreeBuilder.build(Lines.classifyAll(Lines.split(text)));
    }

    public static Resolution resolve(Forest forest) {
        return AttributeResolver.resolve(forest);
    }

    public static String format(Forest forest, FormatMode mode) {
        return TodomeFormatter.format(forest, mode);
    }

    public static DocumentState load(String text) {
        return DocumentState.parse(text);
    }

    /**
     * Replaces lines {@code [startLine, endLine)} of {@code previous} with {@code newText}.
     */
    public static DocumentState applyEdit(DocumentState previous, int startLine, int endLine, String newText) {
        return IncrementalUpdateEngine.apply(previous, new LineEdit(startLine, endLine, newText));
    }

    public static List<String> candidates(QueryIndex index, CandidateKind kind, String prefix) {
        return index.candidates(kind, prefix);
    }

    public static List<OverdueDiagnostic> overdue(Resolution resolution, LocalDate referenceDate) {
        return OverdueDetector.overdue(resolution, referenceDate);
    }
}
