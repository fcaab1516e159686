package io.surfworks.todome.resolve;

import io.surfworks.todome.syntax.ClassifiedLine;
import io.surfworks.todome.syntax.Status;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The attribute values flowing from a node to its children.
 *
 * <p>Each field is merged on its own: an explicit status, priority or due date
 * replaces the inherited one, while categories accumulate. An empty slot means
 * nothing above has set the field.
 */
public record InheritedContext(
    Optional<Status> status,
    Optional<Character> priority,
    Optional<LocalDate> dueDate,
    Set<String> categories
) {
    public static final InheritedContext ROOT =
        new InheritedContext(Optional.empty(), Optional.empty(), Optional.empty(), Set.of());

    /**
     * Context seen by the children of a node carrying {@code item}.
     */
    public InheritedContext merge(ClassifiedLine.Item item) {
        List<String> own = item.categories();
        Set<String> merged = categories;
        if (!own.isEmpty() && !categories.containsAll(own)) {
            LinkedHashSet<String> union = new LinkedHashSet<>(categories);
            union.addAll(own);
            merged = Collections.unmodifiableSet(union);
        }
        return new InheritedContext(
            item.status().or(() -> status),
            item.priority().or(() -> priority),
            item.dueDate().or(() -> dueDate),
            merged);
    }

    /**
     * Effective attributes of the node this context belongs to.
     */
    public ResolvedAttributes toAttributes(List<String> tags) {
        return new ResolvedAttributes(
            status.orElse(Status.TODO),
            priority,
            dueDate,
            categories,
            Collections.unmodifiableSet(new LinkedHashSet<>(tags)));
    }
}
