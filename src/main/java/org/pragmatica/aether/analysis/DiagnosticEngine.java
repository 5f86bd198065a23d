package org.pragmatica.aether.analysis;

import com.google.common.collect.ImmutableList;
import org.pragmatica.aether.document.ParseProblem;
import org.pragmatica.aether.document.ParsedDocument;
import org.pragmatica.aether.error.Diagnostic;
import org.pragmatica.aether.tree.EditorPosition;
import org.pragmatica.aether.tree.EditorRange;

import java.util.List;

/**
 * Turns a parsed document into editor diagnostics: the parse error, if any, and otherwise
 * naming-convention warnings.
 */
public final class DiagnosticEngine {
    private final boolean namingLint;

    private DiagnosticEngine(boolean namingLint) {
        this.namingLint = namingLint;
    }

    public static DiagnosticEngine create() {
        return new DiagnosticEngine(true);
    }

    public static DiagnosticEngine create(boolean namingLint) {
        return new DiagnosticEngine(namingLint);
    }

    /**
     * Diagnostics for a document, parse errors first.
     * The naming lint only runs on documents that parsed cleanly.
     */
    public List<Diagnostic> analyze(ParsedDocument document, String text) {
        var diagnostics = ImmutableList.<Diagnostic>builder();
        for (var problem : document.errors()) {
            diagnostics.add(toDiagnostic(problem));
        }
        if (namingLint && !document.hasErrors()) {
            diagnostics.addAll(NamingLint.check(text));
        }
        return diagnostics.build();
    }

    static Diagnostic toDiagnostic(ParseProblem problem) {
        var start = EditorPosition.fromOneBased(problem.line(), problem.column());
        int width = problem.width() > 0
                    ? problem.width()
                    : estimateWidth(problem.message());
        var range = EditorRange.onLine(start.line(), start.character(), start.character() + width);
        return Diagnostic.parserError(codeOf(problem.message()), problem.message(), range);
    }

    /**
     * Classify a parse error message. The first matching substring wins.
     */
    static String codeOf(String message) {
        if (message.contains("UPPER_SNAKE_CASE")) {
            return "E001";
        }
        if (message.contains("Unexpected token")) {
            return "E002";
        }
        if (message.contains("Expected")) {
            return "E003";
        }
        if (message.contains("Invalid expression")) {
            return "E004";
        }
        return "E000";
    }

    // highlight width when the error has no token extent
    static int estimateWidth(String message) {
        if (message.contains("identifier")) {
            return 10;
        }
        if (message.contains("Expected")) {
            return 5;
        }
        if (message.contains("UPPER_SNAKE_CASE")) {
            return 15;
        }
        return 8;
    }
}
