package org.pragmatica.aether.tree;

/**
 * A position in source text (line and column, both 1-based, counted in code points).
 * The offset is the index into the source string.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public boolean isBefore(SourceLocation other) {
        return line < other.line || (line == other.line && column < other.column);
    }

    /**
     * Zero-based position as seen by editor collaborators.
     */
    public EditorPosition toEditorPosition() {
        return EditorPosition.fromOneBased(line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
