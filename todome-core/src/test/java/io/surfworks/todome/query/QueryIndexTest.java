package io.surfworks.todome.query;

import io.surfworks.todome.syntax.ClassifiedLine;
import io.surfworks.todome.syntax.Lines;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryIndexTest {

    private static List<ClassifiedLine> lines(String text) {
        return Lines.classifyAll(Lines.split(text));
    }

    @Test
    void collectsCategoriesAndTags() {
        QueryIndex index = QueryIndex.of(lines("""
            [work] [Project X] plan @office
            \t[work] review @office @desk
            # [ignored] @ignored
            [home]
            """));

        assertEquals(List.of("Project X", "home", "work"), index.candidates(CandidateKind.CATEGORY, ""));
        assertEquals(List.of("desk", "office"), index.candidates(CandidateKind.TAG, ""));
        assertFalse(index.contains(CandidateKind.TAG, "ignored"));
    }

    @Test
    void prefixMatchIsCaseSensitive() {
        QueryIndex index = QueryIndex.of(lines("[work] [workshop] [Work] [walk] x\n"));

        assertEquals(List.of("work", "workshop"), index.candidates(CandidateKind.CATEGORY, "wo"));
        assertEquals(List.of("Work"), index.candidates(CandidateKind.CATEGORY, "W"));
        assertEquals(List.of(), index.candidates(CandidateKind.CATEGORY, "x"));
    }

    @Test
    void candidatesAreStable() {
        QueryIndex index = QueryIndex.of(lines("[b] [c] [a] x @z @y\n"));
        assertEquals(index.candidates(CandidateKind.CATEGORY, ""), index.candidates(CandidateKind.CATEGORY, ""));
        assertEquals(List.of("a", "b", "c"), index.candidates(CandidateKind.CATEGORY, ""));
    }

    @Test
    void removingOneOfSeveralOccurrencesKeepsName() {
        List<ClassifiedLine> doc = lines("[work] a\n[work] b\n");
        QueryIndex index = QueryIndex.of(doc);

        QueryIndex afterFirst = index.update(doc.subList(0, 1), List.of());
        assertTrue(afterFirst.contains(CandidateKind.CATEGORY, "work"));

        QueryIndex afterBoth = afterFirst.update(doc.subList(1, 2), List.of());
        assertFalse(afterBoth.contains(CandidateKind.CATEGORY, "work"));
        assertEquals(0, afterBoth.size(CandidateKind.CATEGORY));
    }

    @Test
    void repeatsOnOneLineCountOnce() {
        List<ClassifiedLine> doc = lines("[x] [x] a @t @t\n");
        QueryIndex index = QueryIndex.of(doc).update(doc, List.of());
        assertEquals(0, index.size(CandidateKind.CATEGORY));
        assertEquals(0, index.size(CandidateKind.TAG));
    }

    @Test
    void updateLeavesPreviousIndexUntouched() {
        QueryIndex before = QueryIndex.of(lines("[old] x\n"));
        QueryIndex after = before.update(lines("[old] x\n"), lines("[new] y\n"));

        assertEquals(List.of("old"), before.candidates(CandidateKind.CATEGORY, ""));
        assertEquals(List.of("new"), after.candidates(CandidateKind.CATEGORY, ""));
    }

    @Test
    void emptyIndex() {
        assertEquals(List.of(), QueryIndex.empty().candidates(CandidateKind.TAG, ""));
        assertSame(QueryIndex.empty(), QueryIndex.of(List.of()));
    }
}
