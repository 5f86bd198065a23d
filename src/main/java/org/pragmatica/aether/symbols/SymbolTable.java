package org.pragmatica.aether.symbols;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import org.pragmatica.aether.syntax.NamingRules;
import org.pragmatica.aether.tree.EditorPosition;

import java.util.List;
import java.util.Optional;

/**
 * Declared names of one document, split into value bindings and callables.
 * Both lists keep declaration order. All queries are read-only.
 */
public record SymbolTable(List<SymbolInfo> variables, List<SymbolInfo> functions) {

    public static final SymbolTable EMPTY = new SymbolTable(List.of(), List.of());

    public SymbolTable {
        variables = ImmutableList.copyOf(variables);
        functions = ImmutableList.copyOf(functions);
    }

    public boolean isEmpty() {
        return variables.isEmpty() && functions.isEmpty();
    }

    public int size() {
        return variables.size() + functions.size();
    }

    /**
     * Variables first, then functions.
     */
    public Iterable<SymbolInfo> all() {
        return Iterables.concat(variables, functions);
    }

    /**
     * The innermost symbol whose range contains the position. On equal ranges variables win.
     */
    public Optional<SymbolInfo> findAtPosition(EditorPosition position) {
        SymbolInfo best = null;
        for (var symbol : all()) {
            if (!symbol.range().contains(position)) {
                continue;
            }
            if (best == null || isStrictlyInside(symbol, best)) {
                best = symbol;
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<DefinitionLocation> findDefinition(EditorPosition position, String documentUri) {
        return findAtPosition(position)
            .map(symbol -> new DefinitionLocation(documentUri, symbol.selectionRange()));
    }

    /**
     * First declaration with the given name, in {@link #all()} order.
     */
    public Optional<SymbolInfo> findByName(String name) {
        for (var symbol : all()) {
            if (symbol.name().equals(name)) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    public List<DocumentSymbol> toDocumentSymbols(String documentUri) {
        var result = ImmutableList.<DocumentSymbol>builder();
        for (var symbol : all()) {
            result.add(new DocumentSymbol(symbol.name(), symbol.kind(), new DefinitionLocation(documentUri, symbol.range())));
        }
        return result.build();
    }

    /**
     * Rename is not available; callers always receive an empty result.
     */
    public Optional<WorkspaceEdit> renameSymbol(EditorPosition position, String newName, String documentUri) {
        return Optional.empty();
    }

    /**
     * Why a rename target is rejected, or empty when it is a valid declaration name.
     */
    public static Optional<String> renameViolation(String newName) {
        return NamingRules.isUpperSnakeCase(newName)
               ? Optional.empty()
               : Optional.of("'" + newName + "' is not a valid name: " + NamingRules.DECLARATION_REASON);
    }

    private static boolean isStrictlyInside(SymbolInfo candidate, SymbolInfo current) {
        return candidate.range().isWithin(current.range()) && !candidate.range().equals(current.range());
    }
}
