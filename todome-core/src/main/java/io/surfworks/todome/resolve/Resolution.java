package io.surfworks.todome.resolve;

import io.surfworks.todome.tree.Forest;
import io.surfworks.todome.tree.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Output of the attribute resolver: one {@link InheritedContext} per node, keyed
 * by node id. Headers keep a context because their children need it, but they
 * never show up as resolved tasks.
 */
public final class Resolution {

    private final Forest forest;
    private final List<InheritedContext> contexts;

    Resolution(Forest forest, List<InheritedContext> contexts) {
        if (forest.size() != contexts.size()) {
            throw new IllegalArgumentException(
                "context count " + contexts.size() + " does not match node count " + forest.size());
        }
        this.forest = forest;
        this.contexts = List.copyOf(contexts);
    }

    public Forest forest() {
        return forest;
    }

    /**
     * Context a node passes to its children (its own overrides applied).
     */
    public InheritedContext contextOf(int nodeId) {
        return contexts.get(nodeId);
    }

    /**
     * Context a node received from its parent.
     */
    public InheritedContext inheritedBy(int nodeId) {
        int parent = forest.node(nodeId).parent();
        return parent == Node.NO_PARENT ? InheritedContext.ROOT : contexts.get(parent);
    }

    /**
     * Effective attributes of a task node; empty for headers.
     */
    public Optional<ResolvedAttributes> of(int nodeId) {
        Node node = forest.node(nodeId);
        if (node.isHeader()) {
            return Optional.empty();
        }
        return Optional.of(contexts.get(nodeId).toAttributes(node.item().tags()));
    }

    public Optional<ResolvedTask> taskAtLine(int line) {
        return forest.nodeAtLine(line)
            .filter(Node::isTask)
            .map(this::toTask);
    }

    /**
     * Every task in document order.
     */
    public List<ResolvedTask> tasks() {
        List<ResolvedTask> tasks = new ArrayList<>();
        for (Node node : forest.nodes()) {
            if (node.isTask()) {
                tasks.add(toTask(node));
            }
        }
        return tasks;
    }

    private ResolvedTask toTask(Node node) {
        ResolvedAttributes attributes = contexts.get(node.id()).toAttributes(node.item().tags());
        return new ResolvedTask(node.id(), node.line(), node.item().body(), attributes);
    }
}
