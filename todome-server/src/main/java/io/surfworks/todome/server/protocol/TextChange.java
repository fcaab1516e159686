package io.surfworks.todome.server.protocol;

import io.surfworks.todome.incremental.DocumentState;
import io.surfworks.todome.incremental.LineEdit;
import io.surfworks.todome.syntax.ClassifiedLine;

import java.util.List;
import java.util.Objects;

/**
 * A content change as editors send it: replace the characters of {@code range}
 * with {@code text}, or the whole document when {@code range} is null.
 */
public record TextChange(Range range, String text) {

    public TextChange {
        Objects.requireNonNull(text, "text cannot be null");
    }

    public static TextChange full(String text) {
        return new TextChange(null, text);
    }

    public boolean isFull() {
        return range == null;
    }

    /**
     * Rewrites this change as a replacement of whole lines of {@code state}.
     *
     * <p>The touched lines are rebuilt from the text before the range start, the
     * inserted text and the text after the range end. Positions past the end of
     * a line or of the document are clamped.
     */
    public LineEdit toLineEdit(DocumentState state) {
        List<ClassifiedLine> lines = state.forest().lines();
        if (isFull()) {
            return new LineEdit(0, lines.size(), text);
        }
        int startLine = Math.min(range.start().line(), lines.size());
        int endLine = Math.min(range.end().line(), lines.size());
        String first = lineText(lines, startLine);
        String last = lineText(lines, endLine);
        String prefix = first.substring(0, Math.min(range.start().character(), first.length()));
        String suffix = last.substring(Math.min(range.end().character(), last.length()));

        // every segment is a full line, so terminate the last one too
        String replacement = prefix + text + suffix + "\n";
        return new LineEdit(startLine, Math.min(endLine + 1, lines.size()), replacement);
    }

    private static String lineText(List<ClassifiedLine> lines, int line) {
        return line < lines.size() ? lines.get(line).text() : "";
    }
}
