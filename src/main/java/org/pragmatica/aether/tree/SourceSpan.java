package org.pragmatica.aether.tree;

/**
 * Source range from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    /**
     * Zero-width span, used for positions such as the end of input.
     */
    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * Length in UTF-16 units.
     */
    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public boolean isSingleLine() {
        return start.line() == end.line();
    }

    /**
     * Width in columns on a single-line span, 0 on a span crossing lines.
     */
    public int columnWidth() {
        return isSingleLine() ? end.column() - start.column() : 0;
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    public EditorRange toEditorRange() {
        return EditorRange.of(start.toEditorPosition(), end.toEditorPosition());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
