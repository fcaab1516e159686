package io.surfworks.todome.query;

/**
 * Kinds of names offered as completion candidates.
 */
public enum CandidateKind {
    CATEGORY,
    TAG
}
