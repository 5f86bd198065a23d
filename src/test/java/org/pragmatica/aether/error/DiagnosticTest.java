package org.pragmatica.aether.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.aether.tree.EditorPosition;
import org.pragmatica.aether.tree.EditorRange;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void format_singleLine_underlinesRange() {
        var source = "Set A 1\nSet B 2\nSet count 3\n";
        var diagnostic = Diagnostic.parserError("E001", "Bad name", EditorRange.onLine(2, 4, 9))
                                   .withHelp("rename to COUNT");

        var expected = """
            error[E001]: Bad name
              --> main.ae:3:5
              |
            3 | Set count 3
              |     ^^^^^
              |
              = help: rename to COUNT
            """;
        assertEquals(expected, diagnostic.format(source, "main.ae"));
    }

    @Test
    void format_multiLine_underlinesEachLine() {
        var source = "Func F() {\n  Return 1\n}";
        var range = EditorRange.of(EditorPosition.of(0, 5), EditorPosition.of(1, 3));
        var diagnostic = Diagnostic.lintWarning("W001", "Spread", range);

        var formatted = diagnostic.format(source, null);

        assertTrue(formatted.startsWith("warning[W001]: Spread\n  --> 1:6\n"));
        assertTrue(formatted.contains("1 | Func F() {\n  |      ^^^^^\n"));
        assertTrue(formatted.contains("2 |   Return 1\n  | ^^^\n"));
    }

    @Test
    void format_multiLineMessage_showsFirstLineOnly() {
        var diagnostic = Diagnostic.parserError("E000", "first\nsecond", EditorRange.onLine(0, 0, 1));

        assertTrue(diagnostic.format("X", "a.ae").startsWith("error[E000]: first\n"));
    }

    @Test
    void formatSimple_oneBasedPosition() {
        var diagnostic = Diagnostic.parserError("E003", "Expected ')'", EditorRange.onLine(4, 9, 10));

        assertEquals("main.ae:5:10: error: Expected ')'", diagnostic.formatSimple("main.ae"));
    }

    @Test
    void format_collaboratorSeverities_useTheirDisplayNames() {
        var range = EditorRange.onLine(0, 4, 7);
        var info = new Diagnostic(Diagnostic.Severity.INFO, "I001", "editor", "Unused", range, List.of());
        var hint = new Diagnostic(Diagnostic.Severity.HINT, "H001", "editor", "Shorter", range, List.of());

        assertTrue(info.format("Set ABC 1", "a.ae").startsWith("info[I001]: Unused\n"));
        assertEquals("a.ae:1:5: hint: Shorter", hint.formatSimple("a.ae"));
    }

    @Test
    void withNote_appendsWithoutMutating() {
        var original = Diagnostic.lintWarning("W001", "Name", EditorRange.onLine(0, 0, 1));

        var noted = original.withNote("first").withHelp("second");

        assertTrue(original.notes().isEmpty());
        assertEquals(List.of("first", "help: second"), noted.notes());
    }
}
