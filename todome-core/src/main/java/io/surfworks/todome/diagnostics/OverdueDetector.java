package io.surfworks.todome.diagnostics;

import io.surfworks.todome.resolve.Resolution;
import io.surfworks.todome.resolve.ResolvedAttributes;
import io.surfworks.todome.resolve.ResolvedTask;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds overdue tasks. A pure function of the resolution and a caller-supplied
 * reference date; it never reads the clock.
 */
public final class OverdueDetector {

    private OverdueDetector() {}

    public static List<OverdueDiagnostic> overdue(Resolution resolution, LocalDate referenceDate) {
        Objects.requireNonNull(referenceDate, "referenceDate cannot be null");
        List<OverdueDiagnostic> diagnostics = new ArrayList<>();
        for (ResolvedTask task : resolution.tasks()) {
            ResolvedAttributes attributes = task.attributes();
            if (!attributes.isOpen() || attributes.dueDate().isEmpty()) {
                continue;
            }
            LocalDate due = attributes.dueDate().get();
            if (due.isBefore(referenceDate)) {
                long days = ChronoUnit.DAYS.between(due, referenceDate);
                diagnostics.add(new OverdueDiagnostic(task.nodeId(), task.line(), task.body(), due, days));
            }
        }
        return diagnostics;
    }
}
