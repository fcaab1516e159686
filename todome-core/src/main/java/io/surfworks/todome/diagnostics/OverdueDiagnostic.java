package io.surfworks.todome.diagnostics;

import java.time.LocalDate;

/**
 * An open task whose due date lies before the reference date.
 *
 * @param nodeId      node id in the forest
 * @param line        zero-based line number
 * @param body        task body text
 * @param dueDate     effective due date (own or inherited)
 * @param daysOverdue reference date minus due date, always positive
 */
public record OverdueDiagnostic(int nodeId, int line, String body, LocalDate dueDate, long daysOverdue) {
}
