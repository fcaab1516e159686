package io.surfworks.todome.incremental;

import io.surfworks.todome.query.CandidateKind;
import io.surfworks.todome.resolve.Resolution;
import io.surfworks.todome.syntax.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IncrementalUpdateEngineTest {

    private static final String DOCUMENT = """
        [work]
        \t(A) write report @desk
        \t\tcollect numbers
        \t\t- draft intro
        \t* review
        # personal
        - Shopping
        \tmilk
        \t(C) 6 eggs
        \t\t[organic] free range @market
        (2024-05-01) pay rent
        """;

    private static final String[] POOL = {
        "", "# note", "\t# indented note", "plain", "\tchild", "\t\tgrandchild", "\t\t\t\tdeep",
        "[work]", "\t[home]", "- done", "\t* doing", "\t\t= cancelled", "(A) urgent @call",
        "\t(2024-06-01) dated", "[Project X] planning @desk", "+", "\t-", "\t\t(B)", "(AB) literal",
    };

    /**
     * Applies the edit incrementally and checks the outcome against a full parse
     * of the same text.
     */
    private static DocumentState applyAndVerify(DocumentState state, LineEdit edit) {
        DocumentState incremental = IncrementalUpdateEngine.apply(state, edit);
        DocumentState full = DocumentState.parse(incremental.text());
        assertSameState(full, incremental, edit);
        return incremental;
    }

    private static void assertSameState(DocumentState expected, DocumentState actual, LineEdit edit) {
        String context = "after " + edit;
        assertEquals(expected.forest().lines(), actual.forest().lines(), context);
        assertEquals(expected.forest().nodes(), actual.forest().nodes(), context);
        assertEquals(expected.forest().roots(), actual.forest().roots(), context);
        Resolution want = expected.resolution();
        Resolution got = actual.resolution();
        for (int id = 0; id < expected.forest().size(); id++) {
            assertEquals(want.contextOf(id), got.contextOf(id), context + ", node " + id);
        }
        assertEquals(want.tasks(), got.tasks(), context);
        for (CandidateKind kind : CandidateKind.values()) {
            assertEquals(expected.index().candidates(kind, ""), actual.index().candidates(kind, ""), context);
        }
    }

    @Nested
    @DisplayName("Targeted edits")
    class Targeted {

        @Test
        void insertChildUnderLeaf() {
            DocumentState state = DocumentState.parse(DOCUMENT);
            DocumentState next = applyAndVerify(state, LineEdit.insert(11, "\tlate fee"));
            assertEquals(9, next.forest().nodeAtLine(11).orElseThrow().parent());
        }

        @Test
        void dedentReparentsFollowingLines() {
            DocumentState state = DocumentState.parse(DOCUMENT);
            // "\t(A) write report" becomes a root; its children follow it out of [work]
            DocumentState next = applyAndVerify(state, LineEdit.replace(1, "(A) write report @desk"));
            assertTrue(next.forest().node(1).isRoot());
            assertEquals(1, next.forest().node(2).parent());
            assertEquals(Set.of(), next.resolution().taskAtLine(2).orElseThrow().attributes().categories());
        }

        @Test
        void indentMovesLineUnderPreviousRoot() {
            DocumentState state = DocumentState.parse(DOCUMENT);
            DocumentState next = applyAndVerify(state, LineEdit.replace(6, "\t- Shopping"));
            assertEquals(0, next.forest().node(5).parent());
        }

        @Test
        void headerChangePropagatesToDescendants() {
            DocumentState state = DocumentState.parse(DOCUMENT);
            DocumentState next = applyAndVerify(state, LineEdit.replace(0, "- [work]"));
            assertEquals(Status.DONE, next.resolution().taskAtLine(2).orElseThrow().attributes().status());
        }

        @Test
        void removingChildrenTurnsHeaderIntoTask() {
            DocumentState state = DocumentState.parse("[shopping]\n\tmilk\n");
            DocumentState next = applyAndVerify(state, LineEdit.delete(1, 2));
            assertTrue(next.forest().node(0).isTask());
            assertEquals(1, next.resolution().tasks().size());
        }

        @Test
        void addingChildTurnsTaskIntoHeader() {
            DocumentState state = DocumentState.parse("[shopping]\n");
            DocumentState next = applyAndVerify(state, LineEdit.insert(1, "\tmilk"));
            assertTrue(next.forest().node(0).isHeader());
        }

        @Test
        void editsPastTheEndAreClamped() {
            DocumentState state = DocumentState.parse("a\n");
            DocumentState next = applyAndVerify(state, new LineEdit(5, 9, "b"));
            assertEquals(2, next.lineCount());
        }

        @Test
        void deleteEverything() {
            DocumentState state = DocumentState.parse(DOCUMENT);
            DocumentState next = applyAndVerify(state, LineEdit.delete(0, state.lineCount()));
            assertTrue(next.forest().isEmpty());
            assertTrue(next.index().candidates(CandidateKind.CATEGORY, "").isEmpty());
        }

        @Test
        void indexFollowsEdits() {
            DocumentState state = DocumentState.parse(DOCUMENT);
            DocumentState next = applyAndVerify(state, LineEdit.replace(9, "\t\tfree range"));
            assertFalse(next.index().contains(CandidateKind.CATEGORY, "organic"));
            assertFalse(next.index().contains(CandidateKind.TAG, "market"));
            assertTrue(next.index().contains(CandidateKind.CATEGORY, "work"));
        }

        @Test
        void previousStateStaysValid() {
            DocumentState state = DocumentState.parse(DOCUMENT);
            String before = state.text();
            applyAndVerify(state, LineEdit.delete(0, 5));
            assertEquals(before, state.text());
            assertEquals(Optional.of('A'), state.resolution().taskAtLine(1).orElseThrow().attributes().priority());
        }

        @Test
        void editWithNoChange() {
            DocumentState state = DocumentState.parse(DOCUMENT);
            DocumentState next = applyAndVerify(state, LineEdit.insert(3, ""));
            assertEquals(state.forest().nodes(), next.forest().nodes());
        }
    }

    @Nested
    @DisplayName("Randomized edits")
    class Randomized {

        @ParameterizedTest
        @ValueSource(longs = {1L, 7L, 42L, 1234L, 98765L})
        void matchesFullParse(long seed) {
            Random random = new Random(seed);
            DocumentState state = DocumentState.parse(DOCUMENT);
            for (int step = 0; step < 200; step++) {
                int count = state.lineCount();
                int start = random.nextInt(count + 1);
                int end = start + random.nextInt(Math.min(4, count - start) + 1);
                state = applyAndVerify(state, new LineEdit(start, end, randomText(random)));
            }
        }

        private String randomText(Random random) {
            int n = random.nextInt(4);
            List<String> lines = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                lines.add(POOL[random.nextInt(POOL.length)]);
            }
            return String.join("\n", lines);
        }
    }
}
