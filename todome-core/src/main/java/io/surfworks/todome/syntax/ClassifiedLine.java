package io.surfworks.todome.syntax;

import io.surfworks.todome.syntax.Attribute.Category;
import io.surfworks.todome.syntax.Attribute.DueDate;
import io.surfworks.todome.syntax.Attribute.Priority;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One classified line of a to-do document.
 *
 * <p>Lines come in three variants. Only {@link Item} lines take part in the
 * task tree; blank and comment-only lines are kept so the document can be
 * written back without losing anything. Whether an item is a header or a task
 * is decided later, once its children are known.
 */
public sealed interface ClassifiedLine permits ClassifiedLine.Blank, ClassifiedLine.CommentOnly, ClassifiedLine.Item {

    /** The raw line exactly as it was given to the classifier. */
    String text();

    /** Number of leading tab characters. */
    int depth();

    /**
     * A line with nothing but whitespace.
     */
    record Blank(String text, int depth) implements ClassifiedLine {
    }

    /**
     * A line holding only a comment, e.g. {@code \t# groceries for the weekend}.
     *
     * @param comment text after the {@code #} marker, untrimmed
     */
    record CommentOnly(String text, int depth, String comment) implements ClassifiedLine {
    }

    /**
     * A header or task line.
     *
     * @param text       raw line
     * @param depth      leading tab count, before clamping
     * @param status     explicit status symbol, empty if absent
     * @param attributes attribute tokens in written order
     * @param body       remaining text, trimmed; may be empty
     * @param tags       tag names (without {@code @}) found in the body, first occurrence order
     * @param comment    text after the comment marker, if any
     */
    record Item(
        String text,
        int depth,
        Optional<Status> status,
        List<Attribute> attributes,
        String body,
        List<String> tags,
        Optional<String> comment
    ) implements ClassifiedLine {

        public Item {
            Objects.requireNonNull(text, "text cannot be null");
            Objects.requireNonNull(status, "status cannot be null");
            Objects.requireNonNull(body, "body cannot be null");
            Objects.requireNonNull(comment, "comment cannot be null");
            attributes = List.copyOf(attributes);
            tags = List.copyOf(tags);
        }

        public boolean hasBody() {
            return !body.isEmpty();
        }

        /** Explicit priority; the last one wins when a line repeats it. */
        public Optional<Character> priority() {
            Character result = null;
            for (Attribute a : attributes) {
                if (a instanceof Priority p) {
                    result = p.letter();
                }
            }
            return Optional.ofNullable(result);
        }

        /** Explicit due date; the last one wins when a line repeats it. */
        public Optional<LocalDate> dueDate() {
            LocalDate result = null;
            for (Attribute a : attributes) {
                if (a instanceof DueDate d) {
                    result = d.date();
                }
            }
            return Optional.ofNullable(result);
        }

        /** Distinct category names in first-occurrence order. */
        public List<String> categories() {
            LinkedHashSet<String> names = new LinkedHashSet<>();
            for (Attribute a : attributes) {
                if (a instanceof Category c) {
                    names.add(c.name());
                }
            }
            return List.copyOf(names);
        }
    }
}
