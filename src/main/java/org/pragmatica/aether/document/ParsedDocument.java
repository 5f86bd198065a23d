package org.pragmatica.aether.document;

import com.google.common.collect.ImmutableList;
import org.pragmatica.aether.ast.Program;
import org.pragmatica.aether.symbols.SymbolTable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Result of parsing one full document text. Either the program and symbols are populated and
 * there are no errors, or there is exactly one error and both are empty.
 */
public record ParsedDocument(String text, Program program, SymbolTable symbols, List<ParseProblem> errors) {

    public ParsedDocument {
        checkNotNull(text, "text");
        errors = ImmutableList.copyOf(errors);
        checkArgument(errors.size() <= 1, "at most one error per parse, got %s", errors.size());
        checkArgument(errors.isEmpty() || (program.isEmpty() && symbols.isEmpty()),
                      "a failed parse carries no program and no symbols");
    }

    public static ParsedDocument success(String text, Program program, SymbolTable symbols) {
        return new ParsedDocument(text, program, symbols, List.of());
    }

    public static ParsedDocument failure(String text, ParseProblem problem) {
        return new ParsedDocument(text, Program.EMPTY, SymbolTable.EMPTY, List.of(problem));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
