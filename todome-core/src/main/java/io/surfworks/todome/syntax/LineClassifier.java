package io.surfworks.todome.syntax;

import io.surfworks.todome.syntax.Attribute.Category;
import io.surfworks.todome.syntax.Attribute.DueDate;
import io.surfworks.todome.syntax.Attribute.Priority;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifier for one line of to-do notation.
 *
 * Recognizes, left to right:
 * - Indentation: leading tabs (depth); spaces after them are skipped
 * - Status: one of + * - = followed by whitespace, end of content, or an attribute
 * - Attributes: (A) priority, (2024-05-01) due date, [name] category
 * - Body: everything after the last attribute
 * - Comment: from the first '#' not escaped by an odd run of backslashes
 *
 * Classification never fails. Anything that does not match an attribute
 * pattern ends the attribute run and becomes body text.
 */
public final class LineClassifier {

    /** Tag names inside a body: {@code @errand}, {@code @home-office}. */
    public static final Pattern TAG = Pattern.compile("@([A-Za-z0-9][A-Za-z0-9_-]*)");

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
        .withResolverStyle(ResolverStyle.STRICT);

    private static final int DATE_LENGTH = "yyyy-mm-dd".length();

    private LineClassifier() {}

    public static ClassifiedLine classify(String text) {
        int len = text.length();
        int pos = 0;
        int depth = 0;
        while (pos < len && text.charAt(pos) == '\t') {
            depth++;
            pos++;
        }
        while (pos < len && isWhitespace(text.charAt(pos))) {
            pos++;
        }

        int hash = commentStart(text, pos);
        Optional<String> comment = hash < 0 ? Optional.empty() : Optional.of(text.substring(hash + 1));
        String content = text.substring(pos, hash < 0 ? len : hash).stripTrailing();

        if (content.isEmpty()) {
            return comment.isPresent()
                ? new ClassifiedLine.CommentOnly(text, depth, comment.get())
                : new ClassifiedLine.Blank(text, depth);
        }

        int cursor = 0;
        Optional<Status> status = Optional.empty();
        if (startsWithStatus(content)) {
            status = Status.fromSymbol(content.charAt(0));
            cursor = skipWhitespace(content, 1);
        }

        List<Attribute> attributes = new ArrayList<>();
        while (cursor < content.length()) {
            Scanned scanned = scanAttribute(content, cursor);
            if (scanned == null || !endsToken(content, scanned.end(), true)) {
                break;
            }
            attributes.add(scanned.attribute());
            cursor = skipWhitespace(content, scanned.end());
        }

        String body = content.substring(cursor);
        return new ClassifiedLine.Item(text, depth, status, attributes, body, tags(body), comment);
    }

    /**
     * Tag names in first-occurrence order, without the {@code @} sigil.
     */
    public static List<String> tags(String body) {
        LinkedHashSet<String> tags = new LinkedHashSet<>();
        Matcher m = TAG.matcher(body);
        while (m.find()) {
            tags.add(m.group(1));
        }
        return List.copyOf(tags);
    }

    /**
     * Whether {@code content}, already stripped of indentation, opens with a
     * status symbol. The symbol must be followed by whitespace, the end of the
     * content, or a complete attribute token: {@code -(A) fix roof} is Done,
     * {@code -5 apples} and {@code -(note) x} are plain body text.
     */
    public static boolean startsWithStatus(String content) {
        if (content.isEmpty() || !Status.isSymbol(content.charAt(0))) {
            return false;
        }
        if (endsToken(content, 1, false)) {
            return true;
        }
        Scanned next = scanAttribute(content, 1);
        return next != null && endsToken(content, next.end(), true);
    }

    /**
     * Index of the comment marker at or after {@code from}, or -1. A {@code #}
     * preceded by an odd number of backslashes is escaped; {@code \\#} is a
     * literal backslash followed by a comment.
     */
    public static int commentStart(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            if (text.charAt(i) == '#' && !escaped(text, i)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean escaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    // ==================== Attribute scanning ====================

    private record Scanned(Attribute attribute, int end) {}

    private static Scanned scanAttribute(String s, int pos) {
        char c = s.charAt(pos);
        if (c == '(') {
            return scanParenthesized(s, pos);
        }
        if (c == '[') {
            return scanCategory(s, pos);
        }
        return null;
    }

    private static Scanned scanParenthesized(String s, int pos) {
        // (A)
        if (pos + 2 < s.length() && s.charAt(pos + 2) == ')') {
            char letter = s.charAt(pos + 1);
            if (letter >= 'A' && letter <= 'Z') {
                return new Scanned(new Priority(letter), pos + 3);
            }
            return null;
        }
        // (yyyy-MM-dd)
        int close = pos + 1 + DATE_LENGTH;
        if (close < s.length() && s.charAt(close) == ')') {
            LocalDate date = parseDate(s.substring(pos + 1, close));
            if (date != null) {
                return new Scanned(new DueDate(date), close + 1);
            }
        }
        return null;
    }

    private static Scanned scanCategory(String s, int pos) {
        int i = pos + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == ']') {
                break;
            }
            if (c == '[' || c == '#' || c == '\n' || c == '\r') {
                return null;
            }
            i++;
        }
        if (i >= s.length() || i == pos + 1) {
            // unterminated or empty
            return null;
        }
        return new Scanned(new Category(s.substring(pos + 1, i)), i + 1);
    }

    private static LocalDate parseDate(String candidate) {
        if (!candidate.matches("\\d{4}-\\d{2}-\\d{2}")) {
            return null;
        }
        try {
            return LocalDate.parse(candidate, DATE);
        } catch (DateTimeException e) {
            return null;
        }
    }

    // ==================== Helpers ====================

    private static boolean endsToken(String s, int end, boolean allowAdjacentAttribute) {
        if (end >= s.length()) {
            return true;
        }
        char c = s.charAt(end);
        return isWhitespace(c) || (allowAdjacentAttribute && (c == '(' || c == '['));
    }

    private static int skipWhitespace(String s, int pos) {
        while (pos < s.length() && isWhitespace(s.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f';
    }
}
