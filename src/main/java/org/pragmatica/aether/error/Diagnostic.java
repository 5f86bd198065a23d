package org.pragmatica.aether.error;

import com.google.common.collect.ImmutableList;
import org.pragmatica.aether.tree.EditorRange;

import java.util.List;

/**
 * Positioned, severity-tagged message for editor tooling and command-line output.
 *
 * <p>Example output of {@link #format(String, String)}:
 * <pre>
 * warning[W001]: Variable name 'count' should use UPPER_SNAKE_CASE
 *   --> script.ae:3:5
 *    |
 *  3 | Set count 10
 *    |     ^^^^^
 *    |
 *    = help: rename to COUNT
 * </pre>
 *
 * @param severity Severity level
 * @param code     Short classification code (e.g. "E002", "W001")
 * @param source   Producer tag, {@link #PARSER_SOURCE} or {@link #LINT_SOURCE}
 * @param message  Primary message
 * @param range    Zero-based range in the document
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String source,
    String message,
    EditorRange range,
    List<String> notes
) {
    public static final String PARSER_SOURCE = "aether-parser";
    public static final String LINT_SOURCE = "aether-lint";

    public Diagnostic {
        notes = ImmutableList.copyOf(notes);
    }

    /**
     * Severity levels of the editor protocol. The parser and the naming lint emit only
     * {@link #ERROR} and {@link #WARNING}; the other two are available to collaborators
     * building diagnostics of their own.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info"),
        HINT("hint");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * Create an error diagnostic reported by the parser.
     */
    public static Diagnostic parserError(String code, String message, EditorRange range) {
        return new Diagnostic(Severity.ERROR, code, PARSER_SOURCE, message, range, List.of());
    }

    /**
     * Create a warning diagnostic reported by the naming lint.
     */
    public static Diagnostic lintWarning(String code, String message, EditorRange range) {
        return new Diagnostic(Severity.WARNING, code, LINT_SOURCE, message, range, List.of());
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = ImmutableList.<String>builder()
                                    .addAll(notes)
                                    .add(note)
                                    .build();
        return new Diagnostic(severity, code, source, message, range, newNotes);
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with a caret-underlined source excerpt.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        // Header: warning[W001]: message
        sb.append(severity.display());
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(firstLine(message)).append("\n");

        // Location: --> filename:line:column (1-based for humans)
        int startLine = range.start().line() + 1;
        int endLine = range.end().line() + 1;
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(startLine).append(":").append(range.start().character() + 1).append("\n");

        int gutterWidth = String.valueOf(endLine).length();
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = startLine; lineNum <= endLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            String lineContent = lines[lineNum - 1];
            String lineNumStr = String.format("%" + gutterWidth + "d", lineNum);
            sb.append(lineNumStr).append(" | ").append(lineContent).append("\n");

            int startCol = lineNum == startLine ? range.start().character() : 0;
            int endCol = lineNum == endLine ? range.end().character() : lineContent.length();
            sb.append(" ".repeat(gutterWidth)).append(" | ")
              .append(" ".repeat(startCol))
              .append("^".repeat(Math.max(1, endCol - startCol)))
              .append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple(String filename) {
        return String.format("%s:%d:%d: %s: %s",
            filename, range.start().line() + 1, range.start().character() + 1, severity.display(), firstLine(message));
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }
}
