package org.pragmatica.aether.document;

import org.junit.jupiter.api.Test;
import org.pragmatica.aether.ast.Program;
import org.pragmatica.aether.ast.Statement;
import org.pragmatica.aether.symbols.SymbolTable;
import org.pragmatica.aether.syntax.ScriptParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParsedDocumentTest {
    private static final ParseProblem PROBLEM = new ParseProblem("Parse error at line 1, column 1: x", 1, 1, 1);

    @Test
    void failure_hasEmptyProgramAndSymbols() {
        var document = ParsedDocument.failure("x", PROBLEM);

        assertTrue(document.hasErrors());
        assertTrue(document.program().isEmpty());
        assertTrue(document.symbols().isEmpty());
    }

    @Test
    void constructor_rejectsMoreThanOneError() {
        assertThrows(IllegalArgumentException.class,
                     () -> new ParsedDocument("x", Program.EMPTY, SymbolTable.EMPTY, List.of(PROBLEM, PROBLEM)));
    }

    @Test
    void constructor_rejectsProgramAlongsideError() {
        var program = ScriptParser.parse("Set A 1").programOrEmpty();
        assertEquals(1, program.size());
        assertInstanceOf(Statement.Set.class, program.statements().get(0));

        assertThrows(IllegalArgumentException.class,
                     () -> new ParsedDocument("Set A 1", program, SymbolTable.EMPTY, List.of(PROBLEM)));
    }

    @Test
    void frontendConfig_rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> FrontendConfig.DEFAULT.withMaxSourceLength(0));
        assertEquals(10, FrontendConfig.DEFAULT.withMaxSourceLength(10).maxSourceLength());
    }
}
