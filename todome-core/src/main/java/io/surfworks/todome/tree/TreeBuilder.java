package io.surfworks.todome.tree;

import io.surfworks.todome.syntax.ClassifiedLine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the node forest from classified lines in one linear pass.
 *
 * <p>A stack holds the currently open ancestors. For a line of depth d the
 * stack is popped until its top is shallower than d; the line becomes a child
 * of that top (or a root when the stack runs empty). A line indented deeper
 * than top + 1 is clamped to top + 1, and the clamped depth is what gets
 * pushed. Header/task classification happens in {@link #finish()}, once every
 * node's children are known.
 *
 * <p>Besides the one-shot {@link #build(List)}, a builder can be
 * {@linkplain #resume resumed} from a previous forest and later
 * {@linkplain #copyTail copy} an unchanged tail, which is how edits are spliced in.
 */
public final class TreeBuilder {

    private final List<ClassifiedLine> lines;
    private final List<Integer> nodeLines = new ArrayList<>();
    private final List<Integer> depths = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final List<ClassifiedLine.Item> items = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();
    private final Deque<Integer> open = new ArrayDeque<>();

    public TreeBuilder(List<ClassifiedLine> lines) {
        this.lines = lines;
    }

    public static Forest build(List<ClassifiedLine> lines) {
        if (lines.isEmpty()) {
            return Forest.empty();
        }
        TreeBuilder builder = new TreeBuilder(lines);
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i) instanceof ClassifiedLine.Item item) {
                builder.attach(i, item);
            }
        }
        return builder.finish();
    }

    /**
     * Starts a builder over {@code lines} that already holds the first {@code keep}
     * nodes of {@code previous}, with the open-ancestor stack restored to the
     * chain ending at node {@code keep - 1}. Those nodes must sit on lines that
     * did not change.
     */
    public static TreeBuilder resume(Forest previous, int keep, List<ClassifiedLine> lines) {
        TreeBuilder builder = new TreeBuilder(lines);
        for (int id = 0; id < keep; id++) {
            Node n = previous.node(id);
            builder.append(n.line(), n.depth(), n.parent(), n.item());
        }
        if (keep > 0) {
            int last = keep - 1;
            List<Integer> chain = previous.ancestors(last);
            for (int i = chain.size() - 1; i >= 0; i--) {
                builder.open.push(chain.get(i));
            }
            builder.open.push(last);
        }
        return builder;
    }

    /**
     * Attaches an item line and returns its node id.
     */
    public int attach(int line, ClassifiedLine.Item item) {
        int d = item.depth();
        while (!open.isEmpty() && depths.get(open.peek()) >= d) {
            open.pop();
        }
        int parent = open.isEmpty() ? Node.NO_PARENT : open.peek();
        // top is shallower than d here, so top + 1 is either d itself or the clamp
        int depth = parent == Node.NO_PARENT ? 0 : depths.get(parent) + 1;
        int id = append(line, depth, parent, item);
        open.push(id);
        return id;
    }

    /**
     * Copies nodes {@code fromOld..} of {@code previous} after the nodes built so far.
     * Parents below {@code keep} are shared with the resumed prefix and keep their
     * id; all other ids and every line number move by the same offset.
     */
    public void copyTail(Forest previous, int fromOld, int keep, int lineShift) {
        int idShift = size() - fromOld;
        for (int o = fromOld; o < previous.size(); o++) {
            Node n = previous.node(o);
            int parent = n.parent() == Node.NO_PARENT || n.parent() < keep ? n.parent() : n.parent() + idShift;
            append(n.line() + lineShift, n.depth(), parent, n.item());
        }
        open.clear();
    }

    public int size() {
        return nodeLines.size();
    }

    public int parentOf(int id) {
        return parents.get(id);
    }

    public Forest finish() {
        List<Node> nodes = new ArrayList<>(size());
        for (int id = 0; id < size(); id++) {
            ClassifiedLine.Item item = items.get(id);
            List<Integer> kids = children.get(id);
            NodeKind kind = !item.hasBody() && !kids.isEmpty() ? NodeKind.HEADER : NodeKind.TASK;
            nodes.add(new Node(id, nodeLines.get(id), depths.get(id), parents.get(id), item, kind, kids));
        }
        return new Forest(lines, nodes);
    }

    private int append(int line, int depth, int parent, ClassifiedLine.Item item) {
        int id = nodeLines.size();
        nodeLines.add(line);
        depths.add(depth);
        parents.add(parent);
        items.add(item);
        children.add(new ArrayList<>());
        if (parent != Node.NO_PARENT) {
            children.get(parent).add(id);
        }
        return id;
    }
}
