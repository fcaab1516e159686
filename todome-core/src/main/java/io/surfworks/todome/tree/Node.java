package io.surfworks.todome.tree;

import io.surfworks.todome.syntax.ClassifiedLine;

import java.util.List;

/**
 * A slot in the {@link Forest} arena.
 *
 * <p>Node ids follow document order, so a parent's id is always lower than its
 * children's. {@code parent} is only used to walk upwards; children are owned
 * by the parent slot as an id list.
 *
 * @param id       arena index
 * @param line     zero-based line number in the document
 * @param depth    effective (clamped) depth: 0 for roots, parent depth + 1 otherwise
 * @param parent   parent id, or {@link #NO_PARENT} for roots
 * @param item     the classified line
 * @param kind     header or task
 * @param children child ids in document order
 */
public record Node(
    int id,
    int line,
    int depth,
    int parent,
    ClassifiedLine.Item item,
    NodeKind kind,
    List<Integer> children
) {
    public static final int NO_PARENT = -1;

    public Node {
        children = List.copyOf(children);
    }

    public boolean isRoot() {
        return parent == NO_PARENT;
    }

    public boolean isHeader() {
        return kind == NodeKind.HEADER;
    }

    public boolean isTask() {
        return kind == NodeKind.TASK;
    }
}
