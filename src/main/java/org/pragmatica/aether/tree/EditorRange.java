package org.pragmatica.aether.tree;

/**
 * Zero-based range used by editor tooling; both ends are inclusive for containment checks.
 */
public record EditorRange(EditorPosition start, EditorPosition end) {

    public static EditorRange of(EditorPosition start, EditorPosition end) {
        return new EditorRange(start, end);
    }

    public static EditorRange onLine(int line, int startCharacter, int endCharacter) {
        return new EditorRange(EditorPosition.of(line, startCharacter), EditorPosition.of(line, endCharacter));
    }

    public boolean contains(EditorPosition position) {
        return start.compareTo(position) <= 0 && position.compareTo(end) <= 0;
    }

    /**
     * Whether this range lies completely inside the other one.
     */
    public boolean isWithin(EditorRange other) {
        return other.start.compareTo(start) <= 0 && end.compareTo(other.end) <= 0;
    }
}
