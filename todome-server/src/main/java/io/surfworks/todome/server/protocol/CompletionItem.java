package io.surfworks.todome.server.protocol;

import java.util.Objects;

/**
 * A completion proposal.
 *
 * @param label    text shown in the completion list, identical to the inserted text
 * @param detail   short description, or null
 * @param textEdit replacement applied when the item is accepted
 */
public record CompletionItem(String label, String detail, TextEdit textEdit) {

    public CompletionItem {
        Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(textEdit, "textEdit cannot be null");
    }
}
