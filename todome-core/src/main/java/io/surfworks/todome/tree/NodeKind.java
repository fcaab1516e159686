package io.surfworks.todome.tree;

/**
 * What an item line turned out to be once its children are known.
 */
public enum NodeKind {
    /** Attribute-only line with indented children; passes its attributes down, never a task itself. */
    HEADER,
    /** A line with body text, or a body-less line without children. */
    TASK
}
