package io.surfworks.todome.diagnostics;

import java.time.LocalDate;

/**
 * A due-date remark about one open task.
 *
 * @param kind    what kind of remark
 * @param nodeId  node id in the forest
 * @param line    zero-based line number
 * @param body    task body text
 * @param dueDate effective due date
 * @param days    distance between due date and reference date, never negative
 */
public record DueNotice(Kind kind, int nodeId, int line, String body, LocalDate dueDate, long days) {

    public enum Kind {
        OVERDUE,
        DUE_TODAY,
        DUE_SOON
    }

    public String message() {
        return switch (kind) {
            case OVERDUE -> days == 1
                ? "this task is OVERDUE by 1 day."
                : "this task is OVERDUE by " + days + " days.";
            case DUE_TODAY -> "this task is due today.";
            case DUE_SOON -> days == 1
                ? "this task is due tomorrow."
                : "this task is due in " + days + " days.";
        };
    }
}
