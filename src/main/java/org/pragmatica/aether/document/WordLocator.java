package org.pragmatica.aether.document;

import com.google.common.base.Splitter;
import org.pragmatica.aether.tree.EditorPosition;

import java.util.List;
import java.util.Optional;

/**
 * Extracts the identifier-like word around a cursor position, for hover lookups.
 */
public final class WordLocator {
    private static final Splitter LINES = Splitter.on('\n');

    private WordLocator() {}

    /**
     * The run of letters, digits and underscores touching the position, if any.
     * The character index is counted in code points from the line start.
     */
    public static Optional<String> wordAt(String text, EditorPosition position) {
        List<String> lines = LINES.splitToList(text);
        if (position.line() >= lines.size()) {
            return Optional.empty();
        }
        int[] line = lines.get(position.line())
                          .codePoints()
                          .toArray();
        if (position.character() > line.length) {
            return Optional.empty();
        }

        int start = position.character();
        while (start > 0 && isWordPart(line[start - 1])) {
            start--;
        }
        int end = position.character();
        while (end < line.length && isWordPart(line[end])) {
            end++;
        }

        return start < end
               ? Optional.of(new String(line, start, end - start))
               : Optional.empty();
    }

    private static boolean isWordPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
