package io.surfworks.todome.server.protocol;

import java.util.Objects;

public record TextEdit(Range range, String newText) {

    public TextEdit {
        Objects.requireNonNull(range, "range cannot be null");
        Objects.requireNonNull(newText, "newText cannot be null");
    }
}
