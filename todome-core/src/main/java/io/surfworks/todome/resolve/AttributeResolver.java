package io.surfworks.todome.resolve;

import io.surfworks.todome.tree.Forest;
import io.surfworks.todome.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes effective attributes top-down.
 *
 * <p>Node ids are in pre-order, so walking them in id order visits every parent
 * before its children and each node exactly once. A node's context is its
 * parent's context merged with its own explicit attributes; siblings never see
 * each other's overrides.
 */
public final class AttributeResolver {

    private AttributeResolver() {}

    public static Resolution resolve(Forest forest) {
        List<InheritedContext> contexts = new ArrayList<>(forest.size());
        for (Node node : forest.nodes()) {
            contexts.add(contextFor(node, contexts));
        }
        return new Resolution(forest, contexts);
    }

    /**
     * Re-resolves only the nodes in {@code [keep, rebuiltEnd)} of {@code forest}.
     * Nodes below {@code keep} reuse {@code previous} as is; nodes from
     * {@code rebuiltEnd} on reuse the previous node {@code idShift} places
     * earlier. Callers guarantee that neither group's ancestry changed.
     */
    public static Resolution resume(Forest forest, Resolution previous, int keep, int rebuiltEnd, int idShift) {
        List<InheritedContext> contexts = new ArrayList<>(forest.size());
        for (int id = 0; id < keep; id++) {
            contexts.add(previous.contextOf(id));
        }
        for (int id = keep; id < rebuiltEnd; id++) {
            contexts.add(contextFor(forest.node(id), contexts));
        }
        for (int id = rebuiltEnd; id < forest.size(); id++) {
            contexts.add(previous.contextOf(id - idShift));
        }
        return new Resolution(forest, contexts);
    }

    private static InheritedContext contextFor(Node node, List<InheritedContext> resolved) {
        InheritedContext inherited = node.isRoot() ? InheritedContext.ROOT : resolved.get(node.parent());
        return inherited.merge(node.item());
    }
}
