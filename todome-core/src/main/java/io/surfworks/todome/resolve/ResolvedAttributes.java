package io.surfworks.todome.resolve;

import io.surfworks.todome.syntax.Status;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Effective, inheritance-merged attributes of a task.
 *
 * @param status     explicit or inherited status; TODO when nothing sets it
 * @param priority   explicit or inherited priority letter
 * @param dueDate    explicit or inherited due date
 * @param categories inherited categories followed by the node's own, in first-seen order
 * @param tags       the node's own tags; tags are not inherited
 */
public record ResolvedAttributes(
    Status status,
    Optional<Character> priority,
    Optional<LocalDate> dueDate,
    Set<String> categories,
    Set<String> tags
) {
    public ResolvedAttributes {
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(priority, "priority cannot be null");
        Objects.requireNonNull(dueDate, "dueDate cannot be null");
        Objects.requireNonNull(categories, "categories cannot be null");
        Objects.requireNonNull(tags, "tags cannot be null");
    }

    public boolean isOpen() {
        return !status.isClosed();
    }
}
