package io.surfworks.todome.incremental;

import io.surfworks.todome.query.QueryIndex;
import io.surfworks.todome.resolve.AttributeResolver;
import io.surfworks.todome.resolve.Resolution;
import io.surfworks.todome.syntax.ClassifiedLine;
import io.surfworks.todome.syntax.Lines;
import io.surfworks.todome.tree.Forest;
import io.surfworks.todome.tree.Node;
import io.surfworks.todome.tree.TreeBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a line-range edit to a {@link DocumentState}, redoing as little work
 * as possible. The result is always identical to parsing the edited text from
 * scratch.
 *
 * <p>How the work splits up:
 * <ul>
 *   <li>Only the inserted lines are classified; every other line is reused.</li>
 *   <li>Nodes before the edit keep their parents, so the builder resumes with
 *       the open-ancestor stack of the last node before the edit.</li>
 *   <li>The inserted lines are attached, then the old lines after the edit,
 *       until one of them lands under the same parent it had before (or is a
 *       root again). From there on the stack is what it used to be, so the rest
 *       of the old forest is copied with shifted ids.</li>
 *   <li>Only nodes between the edit and that point are re-resolved; nodes
 *       before and after keep their contexts because their ancestry is unchanged.</li>
 *   <li>The completion index subtracts the removed lines and adds the inserted ones.</li>
 * </ul>
 */
public final class IncrementalUpdateEngine {

    private static final Logger LOG = Logger.getLogger(IncrementalUpdateEngine.class.getName());

    private IncrementalUpdateEngine() {}

    public static DocumentState apply(DocumentState previous, LineEdit edit) {
        Forest old = previous.forest();
        int lineCount = old.lineCount();
        int start = Math.min(edit.startLine(), lineCount);
        int end = Math.min(edit.endLine(), lineCount);

        List<ClassifiedLine> inserted = Lines.classifyAll(edit.newLines());
        List<ClassifiedLine> removed = old.lines().subList(start, end);
        int lineShift = inserted.size() - (end - start);

        List<ClassifiedLine> lines = new ArrayList<>(lineCount + lineShift);
        lines.addAll(old.lines().subList(0, start));
        lines.addAll(inserted);
        lines.addAll(old.lines().subList(end, lineCount));

        int keep = old.nodeCountBefore(start);
        TreeBuilder builder = TreeBuilder.resume(old, keep, lines);
        for (int i = 0; i < inserted.size(); i++) {
            if (inserted.get(i) instanceof ClassifiedLine.Item item) {
                builder.attach(start + i, item);
            }
        }

        int next = old.nodeCountBefore(end);
        while (next < old.size()) {
            Node n = old.node(next++);
            int id = builder.attach(n.line() + lineShift, n.item());
            if (reattachedUnchanged(n.parent(), builder.parentOf(id), keep)) {
                break;
            }
        }

        int rebuiltEnd = builder.size();
        int idShift = rebuiltEnd - next;
        builder.copyTail(old, next, keep, lineShift);
        Forest forest = builder.finish();

        Resolution resolution = AttributeResolver.resume(forest, previous.resolution(), keep, rebuiltEnd, idShift);
        QueryIndex index = previous.index().update(removed, inserted);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("edit [%d,%d) +%d lines: reused %d nodes, rebuilt %d, shifted %d",
                start, end, inserted.size(), keep, rebuiltEnd - keep, forest.size() - rebuiltEnd));
        }
        return new DocumentState(forest, resolution, index);
    }

    /**
     * True when a re-attached old node got the parent it had before, which
     * means the open-ancestor stack has converged back to the old one.
     */
    private static boolean reattachedUnchanged(int oldParent, int newParent, int keep) {
        if (oldParent == Node.NO_PARENT) {
            return newParent == Node.NO_PARENT;
        }
        return oldParent < keep && newParent == oldParent;
    }
}
