package io.surfworks.todome.format;

/**
 * How the formatter writes item lines.
 */
public enum FormatMode {
    /** Tokens as written: raw indentation, every attribute in its original order. */
    RAW,
    /** Clamped indentation, canonical attribute order, repeated attributes collapsed. */
    NORMALIZED
}
