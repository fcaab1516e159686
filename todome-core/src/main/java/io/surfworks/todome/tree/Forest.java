package io.surfworks.todome.tree;

import io.surfworks.todome.syntax.ClassifiedLine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Immutable parsed document: every classified line plus the arena of item nodes
 * built from them. Blank and comment-only lines have no node but stay in
 * {@link #lines()} so the document can be formatted back losslessly.
 */
public final class Forest {

    private static final Forest EMPTY = new Forest(List.of(), List.of());

    private final List<ClassifiedLine> lines;
    private final List<Node> nodes;
    private final int[] lineToNode;
    private final List<Integer> roots;

    Forest(List<ClassifiedLine> lines, List<Node> nodes) {
        this.lines = List.copyOf(lines);
        this.nodes = List.copyOf(nodes);
        this.lineToNode = new int[lines.size()];
        Arrays.fill(lineToNode, Node.NO_PARENT);
        List<Integer> rootIds = new ArrayList<>();
        for (Node node : nodes) {
            lineToNode[node.line()] = node.id();
            if (node.isRoot()) {
                rootIds.add(node.id());
            }
        }
        this.roots = List.copyOf(rootIds);
    }

    public static Forest empty() {
        return EMPTY;
    }

    public List<ClassifiedLine> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    public List<Node> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Node node(int id) {
        return nodes.get(id);
    }

    public List<Integer> roots() {
        return roots;
    }

    public Optional<Node> nodeAtLine(int line) {
        if (line < 0 || line >= lineToNode.length || lineToNode[line] == Node.NO_PARENT) {
            return Optional.empty();
        }
        return Optional.of(nodes.get(lineToNode[line]));
    }

    /**
     * Number of nodes whose line is strictly before {@code line}. Since ids follow
     * document order this is also the id the first node at or after {@code line} has.
     */
    public int nodeCountBefore(int line) {
        int lo = 0;
        int hi = nodes.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (nodes.get(mid).line() < line) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * Ancestor ids of a node, nearest first.
     */
    public List<Integer> ancestors(int id) {
        List<Integer> chain = new ArrayList<>();
        int p = nodes.get(id).parent();
        while (p != Node.NO_PARENT) {
            chain.add(p);
            p = nodes.get(p).parent();
        }
        return chain;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Forest[lines=").append(lines.size())
            .append(", nodes=").append(nodes.size()).append("]");
        for (Node node : nodes) {
            sb.append('\n').append("  ".repeat(node.depth()))
                .append(node.isHeader() ? "header" : "task")
                .append('@').append(node.line() + 1)
                .append(" \"").append(node.item().body()).append('"');
        }
        return sb.toString();
    }
}
