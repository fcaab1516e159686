package io.surfworks.todome.incremental;

import io.surfworks.todome.query.QueryIndex;
import io.surfworks.todome.resolve.AttributeResolver;
import io.surfworks.todome.resolve.Resolution;
import io.surfworks.todome.syntax.ClassifiedLine;
import io.surfworks.todome.syntax.Lines;
import io.surfworks.todome.tree.Forest;
import io.surfworks.todome.tree.TreeBuilder;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Everything known about one version of a document: the forest, its
 * resolution and the completion index. Immutable, so a state handed to a
 * reader stays valid while the next one is being built.
 */
public record DocumentState(Forest forest, Resolution resolution, QueryIndex index) {

    public DocumentState {
        Objects.requireNonNull(forest, "forest cannot be null");
        Objects.requireNonNull(resolution, "resolution cannot be null");
        Objects.requireNonNull(index, "index cannot be null");
        if (resolution.forest() != forest) {
            throw new IllegalArgumentException("resolution belongs to a different forest");
        }
    }

    public static DocumentState empty() {
        return parse("");
    }

    /**
     * Full parse from scratch.
     */
    public static DocumentState parse(String text) {
        List<ClassifiedLine> lines = Lines.classifyAll(Lines.split(text));
        Forest forest = TreeBuilder.build(lines);
        return new DocumentState(forest, AttributeResolver.resolve(forest), QueryIndex.of(lines));
    }

    public int lineCount() {
        return forest.lineCount();
    }

    /**
     * Raw document text, every line terminated by {@code \n}. Parsing it again
     * yields the same lines.
     */
    public String text() {
        return forest.lines().stream()
            .map(line -> line.text() + "\n")
            .collect(Collectors.joining());
    }
}
