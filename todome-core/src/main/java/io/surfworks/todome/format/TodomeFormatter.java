package io.surfworks.todome.format;

import io.surfworks.todome.resolve.AttributeResolver;
import io.surfworks.todome.resolve.Resolution;
import io.surfworks.todome.syntax.Attribute;
import io.surfworks.todome.syntax.ClassifiedLine;
import io.surfworks.todome.syntax.LineClassifier;
import io.surfworks.todome.syntax.Status;
import io.surfworks.todome.tree.Forest;
import io.surfworks.todome.tree.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes a parsed document back as canonical text.
 *
 * <p>Per item line: tabs, status symbol, priority, due date, categories, body,
 * comment, separated by single spaces. Every line ends with a newline. Only
 * explicitly written attributes are emitted, never inherited ones, so
 * re-parsing the output resolves to the same attributes. Formatting canonical
 * text reproduces it unchanged.
 */
public final class TodomeFormatter {

    private TodomeFormatter() {}

    public static String format(Forest forest, FormatMode mode) {
        Resolution resolution = mode == FormatMode.NORMALIZED ? AttributeResolver.resolve(forest) : null;
        StringBuilder out = new StringBuilder();
        List<ClassifiedLine> lines = forest.lines();
        for (int i = 0; i < lines.size(); i++) {
            ClassifiedLine line = lines.get(i);
            if (line instanceof ClassifiedLine.Blank) {
                out.append('\n');
            } else if (line instanceof ClassifiedLine.CommentOnly c) {
                out.append("\t".repeat(c.depth())).append(comment(c.comment())).append('\n');
            } else if (line instanceof ClassifiedLine.Item item) {
                Node node = forest.nodeAtLine(i).orElseThrow();
                String text = mode == FormatMode.RAW
                    ? formatRaw(item)
                    : formatNormalized(node, resolution);
                out.append(text).append('\n');
            }
        }
        return out.toString();
    }

    /**
     * Canonical text of a single item as written, at its raw depth.
     */
    public static String formatRaw(ClassifiedLine.Item item) {
        List<String> parts = new ArrayList<>();
        item.status().ifPresent(s -> parts.add(String.valueOf(s.symbol())));
        for (Attribute a : item.attributes()) {
            parts.add(a.toNotation());
        }
        return join(item.depth(), parts, item);
    }

    private static String formatNormalized(Node node, Resolution resolution) {
        ClassifiedLine.Item item = node.item();
        List<String> parts = new ArrayList<>();
        item.status()
            .filter(s -> !canOmit(s, item, resolution.inheritedBy(node.id()).status()))
            .ifPresent(s -> parts.add(String.valueOf(s.symbol())));
        item.priority().ifPresent(p -> parts.add(new Attribute.Priority(p).toNotation()));
        item.dueDate().ifPresent(d -> parts.add(new Attribute.DueDate(d).toNotation()));
        for (String category : item.categories()) {
            parts.add(new Attribute.Category(category).toNotation());
        }
        return join(node.depth(), parts, item);
    }

    /**
     * An explicit ToDo may go when ToDo is what the line inherits anyway and the
     * rest of the line still parses as the same item without it.
     */
    private static boolean canOmit(Status status, ClassifiedLine.Item item, Optional<Status> inherited) {
        if (status != Status.TODO || inherited.orElse(Status.TODO) != Status.TODO) {
            return false;
        }
        if (!item.attributes().isEmpty()) {
            return true;
        }
        String body = item.body();
        return !body.isEmpty() && !LineClassifier.startsWithStatus(body);
    }

    private static String join(int depth, List<String> parts, ClassifiedLine.Item item) {
        if (item.hasBody()) {
            parts.add(item.body());
        }
        item.comment().ifPresent(c -> parts.add(comment(c)));
        return "\t".repeat(depth) + String.join(" ", parts);
    }

    private static String comment(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? "#" : "# " + trimmed;
    }
}
