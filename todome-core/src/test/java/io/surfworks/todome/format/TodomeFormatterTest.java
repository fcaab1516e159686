package io.surfworks.todome.format;

import io.surfworks.todome.Todome;
import io.surfworks.todome.resolve.ResolvedTask;
import io.surfworks.todome.tree.Forest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TodomeFormatterTest {

    private static final String MESSY = """
        - Shopping   #  weekly run
        \t\t\tmilk
        \t(C)   6 eggs  @store
          + (A)(2024-05-01)[work] [work] [Project X]   write report
        [home]
        \t+ - literally a dash
        \t+   vacuum
        \t(B) (A) (2024-01-01) (2024-02-02) repaint
        \t\\#hash in body #real comment
        # free comment
        \t#

        *
        \tchild of a status-only header
        (AB) text
        -5 apples
        +
        """;

    private static String format(String text, FormatMode mode) {
        return Todome.format(Todome.parse(text), mode);
    }

    private static List<ResolvedTask> tasks(String text) {
        return Todome.resolve(Todome.parse(text)).tasks();
    }

    @Nested
    @DisplayName("Raw mode")
    class Raw {

        @Test
        void keepsWrittenAttributesAndDepth() {
            assertEquals("\t\t+ (A) (A) [x] body # note\n", format("\t\t+  (A) (A)[x]  body   #  note", FormatMode.RAW));
        }

        @Test
        void keepsOverIndentation() {
            assertEquals("a\n\t\t\tb\n", format("a\n\t\t\tb", FormatMode.RAW));
        }

        @Test
        void blankAndCommentLines() {
            assertEquals("\n\t# note\n#\n", format("   \n\t#   note  \n#", FormatMode.RAW));
        }
    }

    @Nested
    @DisplayName("Normalized mode")
    class Normalized {

        @Test
        void canonicalAttributeOrder() {
            assertEquals("(A) (2024-05-01) [x] [y] body\n",
                format("[x] (2024-05-01) [y] (A) [x] body", FormatMode.NORMALIZED));
        }

        @Test
        void lastRepeatedValueWins() {
            assertEquals("(B) (2024-02-02) x\n", format("(A) (2024-01-01) (B) (2024-02-02) x", FormatMode.NORMALIZED));
        }

        @Test
        void clampsDepth() {
            assertEquals("a\n\tb\n\t\tc\n", format("a\n\t\t\tb\n\t\tc", FormatMode.NORMALIZED));
        }

        @Test
        void dropsRedundantExplicitTodo() {
            assertEquals("(A) call\n", format("+ (A) call", FormatMode.NORMALIZED));
            assertEquals("call\n", format("+ call", FormatMode.NORMALIZED));
        }

        @Test
        void keepsExplicitTodoThatOverrides() {
            assertEquals("- done\n\t+ reopened\n", format("- done\n\t+ reopened", FormatMode.NORMALIZED));
        }

        @Test
        void keepsExplicitTodoWhenDroppingWouldChangeTheLine() {
            assertEquals("+ - dash\n", format("+ - dash", FormatMode.NORMALIZED));
            assertEquals("+\n", format("+", FormatMode.NORMALIZED));
            assertEquals("+ -(A) x\n", format("+ -(A) x", FormatMode.NORMALIZED));
            assertEquals("+ *[work] y\n", format("+ *[work] y", FormatMode.NORMALIZED));
        }

        @Test
        void separatesStatusFromAdjacentAttribute() {
            assertEquals("- (A) fix roof\n", format("-(A) fix roof", FormatMode.NORMALIZED));
            assertEquals("* [work] call\n", format("*[work] call", FormatMode.RAW));
            assertEquals("-(note) x\n", format("-(note) x", FormatMode.NORMALIZED));
        }

        @Test
        void neverEmitsInheritedAttributes() {
            assertEquals("(A) [w] parent\n\tchild\n", format("(A) [w] parent\n\tchild", FormatMode.NORMALIZED));
        }
    }

    @Nested
    @DisplayName("Guarantees")
    class Guarantees {

        @ParameterizedTest
        @EnumSource(FormatMode.class)
        void idempotent(FormatMode mode) {
            String once = format(MESSY, mode);
            assertEquals(once, format(once, mode));
        }

        @ParameterizedTest
        @EnumSource(FormatMode.class)
        void preservesResolvedAttributes(FormatMode mode) {
            List<ResolvedTask> before = tasks(MESSY);
            List<ResolvedTask> after = tasks(format(MESSY, mode));

            assertEquals(before.size(), after.size());
            for (int i = 0; i < before.size(); i++) {
                assertEquals(before.get(i).body(), after.get(i).body());
                assertEquals(before.get(i).attributes(), after.get(i).attributes(), "task " + before.get(i).body());
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "a\n",
            "(A) (2024-05-01) [x] body # note\n",
            "- Shopping\n\tmilk\n\t(C) 6 eggs\n",
            "[shopping]\n\t- Buy milk\n\t6 eggs\n",
            "\n# c\n\t#\n"
        })
        void canonicalTextIsUnchanged(String canonical) {
            assertEquals(canonical, format(canonical, FormatMode.RAW));
            assertEquals(canonical, format(canonical, FormatMode.NORMALIZED));
        }

        @Test
        void emptyDocument() {
            Forest forest = Todome.parse("");
            assertEquals("", Todome.format(forest, FormatMode.RAW));
            assertEquals("", Todome.format(forest, FormatMode.NORMALIZED));
        }
    }
}
