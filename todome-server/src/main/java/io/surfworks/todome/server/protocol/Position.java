package io.surfworks.todome.server.protocol;

/**
 * Zero-based line and character offset. Characters count UTF-16 code units,
 * which is also how Java strings are indexed.
 */
public record Position(int line, int character) implements Comparable<Position> {

    public Position {
        if (line < 0 || character < 0) {
            throw new IllegalArgumentException("Position must not be negative: " + line + ":" + character);
        }
    }

    @Override
    public int compareTo(Position other) {
        return line != other.line ? Integer.compare(line, other.line) : Integer.compare(character, other.character);
    }
}
