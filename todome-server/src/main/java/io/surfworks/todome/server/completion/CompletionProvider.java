package io.surfworks.todome.server.completion;

import io.surfworks.todome.incremental.DocumentState;
import io.surfworks.todome.query.CandidateKind;
import io.surfworks.todome.query.QueryIndex;
import io.surfworks.todome.server.protocol.CompletionItem;
import io.surfworks.todome.server.protocol.Position;
import io.surfworks.todome.server.protocol.Range;
import io.surfworks.todome.server.protocol.TextEdit;
import io.surfworks.todome.syntax.LineClassifier;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Completion for categories, tags and due dates.
 *
 * <p>The kind of completion comes from the trigger character when the editor
 * sends one ({@code [}, {@code @} or {@code (}), otherwise from the token the
 * cursor sits in. Each proposal replaces everything from the opening character
 * up to the cursor, plus a closing bracket right after the cursor. Nothing is
 * offered inside a comment.
 */
public final class CompletionProvider {

    private static final Logger LOG = Logger.getLogger(CompletionProvider.class.getName());

    /** Characters editors should be told to trigger completion on. */
    public static final List<String> TRIGGER_CHARACTERS = List.of("[", "@", "(");

    private enum Kind {
        CATEGORY('[', ']'),
        TAG('@'),
        DATE('(', ')');

        final char open;
        private final boolean hasClose;
        private final char close;

        Kind(char open) {
            this.open = open;
            this.hasClose = false;
            this.close = open;
        }

        Kind(char open, char close) {
            this.open = open;
            this.hasClose = true;
            this.close = close;
        }

        boolean closesAt(String lineText, int column) {
            return hasClose && column < lineText.length() && lineText.charAt(column) == close;
        }
    }

    /**
     * @param state   snapshot of the document
     * @param cursor  cursor position
     * @param trigger trigger character sent by the editor, or null
     * @param today   reference date for date proposals
     */
    public List<CompletionItem> complete(DocumentState state, Position cursor, String trigger, LocalDate today) {
        if (cursor.line() >= state.lineCount()) {
            return List.of();
        }
        String lineText = state.forest().lines().get(cursor.line()).text();
        return complete(lineText, state.index(), cursor, trigger, today);
    }

    /**
     * Completion on a single line of text against {@code index}, which may span
     * several documents.
     */
    public List<CompletionItem> complete(String lineText, QueryIndex index, Position cursor, String trigger,
                                         LocalDate today) {
        Objects.requireNonNull(today, "today cannot be null");
        int column = Math.min(cursor.character(), lineText.length());
        int hash = LineClassifier.commentStart(lineText, 0);
        if (hash >= 0 && hash < column) {
            return List.of();
        }

        Kind kind = trigger != null ? fromTrigger(trigger) : fromToken(lineText, column);
        if (kind == null) {
            return List.of();
        }
        int open = lineText.lastIndexOf(kind.open, column - 1);
        int from = open >= 0 ? open : column;
        int to = kind.closesAt(lineText, column) ? column + 1 : column;
        String prefix = open >= 0 ? lineText.substring(open + 1, column) : "";
        Range range = Range.onLine(cursor.line(), from, to);

        List<CompletionItem> items = switch (kind) {
            case CATEGORY -> names(index, CandidateKind.CATEGORY, prefix, "[", "]", range);
            case TAG -> names(index, CandidateKind.TAG, prefix, "@", "", range);
            case DATE -> dates(today, range);
        };
        LOG.fine(() -> items.size() + " " + kind + " completions at " + cursor);
        return items;
    }

    private static List<CompletionItem> names(QueryIndex index, CandidateKind kind, String prefix,
                                              String before, String after, Range range) {
        List<CompletionItem> items = new ArrayList<>();
        for (String name : index.candidates(kind, prefix)) {
            String text = before + name + after;
            items.add(new CompletionItem(text, null, new TextEdit(range, text)));
        }
        return items;
    }

    private static List<CompletionItem> dates(LocalDate today, Range range) {
        List<CompletionItem> items = new ArrayList<>();
        items.add(date(today, "today", range));
        items.add(date(today.plusDays(1), "tomorrow", range));
        items.add(date(today.plusDays(2), "2 days later", range));
        items.add(date(today.plusWeeks(1), "1 week later", range));
        return items;
    }

    private static CompletionItem date(LocalDate date, String detail, Range range) {
        String text = "(" + date + ")";
        return new CompletionItem(text, detail, new TextEdit(range, text));
    }

    private static Kind fromTrigger(String trigger) {
        return switch (trigger) {
            case "[" -> Kind.CATEGORY;
            case "@" -> Kind.TAG;
            case "(" -> Kind.DATE;
            default -> null;
        };
    }

    /**
     * Walks left from the cursor to the opening character of the current token.
     * Category names may contain spaces; tags and dates may not.
     */
    private static Kind fromToken(String lineText, int column) {
        boolean sawSpace = false;
        for (int i = column - 1; i >= 0; i--) {
            char c = lineText.charAt(i);
            switch (c) {
                case '[':
                    return Kind.CATEGORY;
                case ']':
                case ')':
                    return null;
                case '@':
                    if (!sawSpace) {
                        return Kind.TAG;
                    }
                    break;
                case '(':
                    if (!sawSpace) {
                        return Kind.DATE;
                    }
                    break;
                case ' ':
                case '\t':
                    sawSpace = true;
                    break;
                default:
                    break;
            }
        }
        return null;
    }
}
