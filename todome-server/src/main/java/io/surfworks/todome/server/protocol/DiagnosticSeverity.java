package io.surfworks.todome.server.protocol;

/**
 * Diagnostic severity with the numeric codes editors expect on the wire.
 */
public enum DiagnosticSeverity {
    ERROR(1),
    WARNING(2),
    INFORMATION(3),
    HINT(4);

    private final int code;

    DiagnosticSeverity(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static DiagnosticSeverity fromCode(int code) {
        for (DiagnosticSeverity severity : values()) {
            if (severity.code == code) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown diagnostic severity: " + code);
    }
}
