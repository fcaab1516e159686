package io.surfworks.todome.syntax;

import java.util.Optional;

/**
 * Task status and the single-character symbol that marks it at the start of a line.
 */
public enum Status {
    TODO('+'),
    DOING('*'),
    DONE('-'),
    CANCELLED('=');

    private final char symbol;

    Status(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * Done and cancelled tasks are closed; they never produce due-date diagnostics.
     */
    public boolean isClosed() {
        return this == DONE || this == CANCELLED;
    }

    public static Optional<Status> fromSymbol(char c) {
        return switch (c) {
            case '+' -> Optional.of(TODO);
            case '*' -> Optional.of(DOING);
            case '-' -> Optional.of(DONE);
            case '=' -> Optional.of(CANCELLED);
            default -> Optional.empty();
        };
    }

    public static boolean isSymbol(char c) {
        return fromSymbol(c).isPresent();
    }
}
