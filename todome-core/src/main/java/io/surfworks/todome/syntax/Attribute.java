package io.surfworks.todome.syntax;

import java.time.LocalDate;
import java.util.Objects;

/**
 * An attribute token written in front of a line's body: priority, due date or category.
 */
public sealed interface Attribute permits Attribute.Priority, Attribute.DueDate, Attribute.Category {

    /**
     * Canonical textual form, e.g. {@code (A)}, {@code (2024-05-01)}, {@code [work]}.
     */
    String toNotation();

    /**
     * Priority: {@code (A)} .. {@code (Z)}
     */
    record Priority(char letter) implements Attribute {
        public Priority {
            if (letter < 'A' || letter > 'Z') {
                throw new IllegalArgumentException("Priority must be an uppercase letter: " + letter);
            }
        }

        @Override
        public String toNotation() {
            return "(" + letter + ")";
        }
    }

    /**
     * Due date: {@code (2024-05-01)}
     */
    record DueDate(LocalDate date) implements Attribute {
        public DueDate {
            Objects.requireNonNull(date, "date cannot be null");
        }

        @Override
        public String toNotation() {
            return "(" + date + ")";
        }
    }

    /**
     * Category: {@code [work]}. Names are kept exactly as written, inner spaces included.
     */
    record Category(String name) implements Attribute {
        public Category {
            Objects.requireNonNull(name, "name cannot be null");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Category name cannot be empty");
            }
        }

        @Override
        public String toNotation() {
            return "[" + name + "]";
        }
    }
}
