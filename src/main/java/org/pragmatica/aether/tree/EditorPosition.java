package org.pragmatica.aether.tree;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Zero-based line/character position used by editor tooling.
 */
public record EditorPosition(int line, int character) implements Comparable<EditorPosition> {

    public EditorPosition {
        checkArgument(line >= 0, "line must not be negative: %s", line);
        checkArgument(character >= 0, "character must not be negative: %s", character);
    }

    public static EditorPosition of(int line, int character) {
        return new EditorPosition(line, character);
    }

    /**
     * Convert 1-based parser coordinates, saturating at zero.
     */
    public static EditorPosition fromOneBased(int line, int column) {
        return new EditorPosition(Math.max(0, line - 1), Math.max(0, column - 1));
    }

    @Override
    public int compareTo(EditorPosition other) {
        return line != other.line
               ? Integer.compare(line, other.line)
               : Integer.compare(character, other.character);
    }
}
