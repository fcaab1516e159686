package io.surfworks.todome.server.protocol;

import java.util.Objects;

/**
 * Half-open span between two positions.
 */
public record Range(Position start, Position end) {

    public Range {
        Objects.requireNonNull(start, "start cannot be null");
        Objects.requireNonNull(end, "end cannot be null");
        if (end.compareTo(start) < 0) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
    }

    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /**
     * Columns {@code [from, to)} of a single line.
     */
    public static Range onLine(int line, int from, int to) {
        return of(line, from, line, to);
    }
}
