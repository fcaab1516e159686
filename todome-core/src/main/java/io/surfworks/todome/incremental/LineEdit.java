package io.surfworks.todome.incremental;

import io.surfworks.todome.syntax.Lines;

import java.util.List;
import java.util.Objects;

/**
 * Replaces lines {@code [startLine, endLine)} of a document with the lines of {@code newText}.
 *
 * <p>{@code startLine == endLine} inserts; an empty {@code newText} deletes.
 * Line numbers past the end of the document are clamped when applied.
 */
public record LineEdit(int startLine, int endLine, String newText) {

    public LineEdit {
        Objects.requireNonNull(newText, "newText cannot be null");
        if (startLine < 0) {
            throw new IllegalArgumentException("startLine must not be negative: " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                "endLine " + endLine + " is before startLine " + startLine);
        }
    }

    public static LineEdit insert(int line, String text) {
        return new LineEdit(line, line, text);
    }

    public static LineEdit delete(int startLine, int endLine) {
        return new LineEdit(startLine, endLine, "");
    }

    public static LineEdit replace(int line, String text) {
        return new LineEdit(line, line + 1, text);
    }

    public List<String> newLines() {
        return Lines.split(newText);
    }
}
