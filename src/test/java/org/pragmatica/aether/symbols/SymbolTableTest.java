package org.pragmatica.aether.symbols;

import org.junit.jupiter.api.Test;
import org.pragmatica.aether.syntax.ScriptParser;
import org.pragmatica.aether.tree.EditorPosition;
import org.pragmatica.aether.tree.EditorRange;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolTableTest {
    private static final String URI = "file:///work/main.ae";

    private static final String SOURCE = """
        Set TOTAL 0
        Func ADD(A, B) {
            Set LOCAL A + B
            Return LOCAL
        }
        """;

    private final SymbolTable table = SymbolExtractor.extract(ScriptParser.parse(SOURCE).programOrEmpty(), SOURCE);

    @Test
    void findAtPosition_insideNestedDeclaration_returnsInnermost() {
        assertThat(table.findAtPosition(EditorPosition.of(2, 10)))
            .hasValueSatisfying(symbol -> assertThat(symbol.name()).isEqualTo("LOCAL"));
    }

    @Test
    void findAtPosition_insideFunctionBody_returnsFunction() {
        assertThat(table.findAtPosition(EditorPosition.of(3, 6)))
            .hasValueSatisfying(symbol -> assertThat(symbol.name()).isEqualTo("ADD"));
    }

    @Test
    void findAtPosition_outsideAnyDeclaration_isEmpty() {
        assertThat(table.findAtPosition(EditorPosition.of(0, 20))).isEmpty();
        assertThat(table.findAtPosition(EditorPosition.of(9, 0))).isEmpty();
    }

    @Test
    void findAtPosition_equalRanges_preferVariables() {
        var range = EditorRange.onLine(0, 0, 10);
        var function = new SymbolInfo("F", SymbolKind.FUNCTION, range, range, "Function: F()", Optional.empty());
        var variable = new SymbolInfo("V", SymbolKind.VARIABLE, range, range, "Variable: V", Optional.empty());
        var tied = new SymbolTable(List.of(variable), List.of(function));

        assertThat(tied.findAtPosition(EditorPosition.of(0, 3))).contains(variable);
    }

    @Test
    void findDefinition_pointsAtNameToken() {
        var location = table.findDefinition(EditorPosition.of(1, 0), URI);

        assertThat(location).contains(new DefinitionLocation(URI, EditorRange.onLine(1, 5, 8)));
    }

    @Test
    void findByName_unknownName_isEmpty() {
        assertThat(table.findByName("MISSING")).isEmpty();
        assertThat(table.findByName("TOTAL")).isPresent();
    }

    @Test
    void toDocumentSymbols_variablesThenFunctions() {
        var symbols = table.toDocumentSymbols(URI);

        assertThat(symbols).extracting(DocumentSymbol::name).containsExactly("TOTAL", "LOCAL", "ADD");
        assertThat(symbols).allSatisfy(symbol -> assertThat(symbol.location().uri()).isEqualTo(URI));
        assertThat(symbols.get(2).kind()).isEqualTo(SymbolKind.FUNCTION);
        assertThat(symbols.get(2).location().range())
            .isEqualTo(EditorRange.of(EditorPosition.of(1, 0), EditorPosition.of(4, 1)));
    }

    @Test
    void renameSymbol_neverProducesEdit() {
        assertThat(table.renameSymbol(EditorPosition.of(0, 5), "GRAND_TOTAL", URI)).isEmpty();
    }

    @Test
    void renameViolation_requiresUpperSnakeCase() {
        assertThat(SymbolTable.renameViolation("GRAND_TOTAL")).isEmpty();
        assertThat(SymbolTable.renameViolation("grandTotal")).isPresent();
    }
}
