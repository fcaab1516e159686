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
 * Grades open tasks by how close their due date is: overdue, due on the
 * reference date, or due within the look-ahead window. Closed tasks and tasks
 * without a due date produce nothing.
 */
public final class DueDateAdvisor {

    public static final int DEFAULT_DUE_SOON_DAYS = 7;

    private final int dueSoonDays;

    public DueDateAdvisor() {
        this(DEFAULT_DUE_SOON_DAYS);
    }

    /**
     * @param dueSoonDays look-ahead window; 0 turns DUE_SOON notices off
     */
    public DueDateAdvisor(int dueSoonDays) {
        if (dueSoonDays < 0) {
            throw new IllegalArgumentException("dueSoonDays must not be negative: " + dueSoonDays);
        }
        this.dueSoonDays = dueSoonDays;
    }

    public int dueSoonDays() {
        return dueSoonDays;
    }

    public List<DueNotice> advise(Resolution resolution, LocalDate referenceDate) {
        Objects.requireNonNull(referenceDate, "referenceDate cannot be null");
        List<DueNotice> notices = new ArrayList<>();
        for (ResolvedTask task : resolution.tasks()) {
            ResolvedAttributes attributes = task.attributes();
            if (!attributes.isOpen() || attributes.dueDate().isEmpty()) {
                continue;
            }
            LocalDate due = attributes.dueDate().get();
            long delta = ChronoUnit.DAYS.between(referenceDate, due);
            DueNotice.Kind kind;
            if (delta < 0) {
                kind = DueNotice.Kind.OVERDUE;
            } else if (delta == 0) {
                kind = DueNotice.Kind.DUE_TODAY;
            } else if (delta <= dueSoonDays) {
                kind = DueNotice.Kind.DUE_SOON;
            } else {
                continue;
            }
            notices.add(new DueNotice(kind, task.nodeId(), task.line(), task.body(), due, Math.abs(delta)));
        }
        return notices;
    }
}
