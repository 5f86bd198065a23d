package org.pragmatica.aether.symbols;

import com.google.common.base.Splitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Finds the comment block written directly above a declaration.
 *
 * <p>Walking upward from the declaration line, contiguous {@code //} lines and single-line block
 * comments are collected and blank lines are skipped. The first other line ends the block.
 * A multi-line block comment is taken whole and ends the block as well.
 */
final class DocCommentLocator {
    private static final Splitter LINES = Splitter.on('\n');

    private final List<String> lines;

    private DocCommentLocator(List<String> lines) {
        this.lines = lines;
    }

    static DocCommentLocator forText(String text) {
        return new DocCommentLocator(LINES.splitToList(text));
    }

    /**
     * Documentation for a declaration starting on the given 1-based line.
     */
    Optional<String> documentationAbove(int declarationLine) {
        var collected = new ArrayList<String>();
        int index = declarationLine - 2;

        while (index >= 0) {
            var line = lines.get(index).strip();
            if (line.isEmpty()) {
                index--;
            } else if (line.startsWith("//")) {
                addIfPresent(collected, line.substring(2));
                index--;
            } else if (line.startsWith("/*") && line.endsWith("*/") && line.length() >= 4) {
                addIfPresent(collected, blockLine(line));
                index--;
            } else if (line.endsWith("*/") && !line.contains("/*")) {
                collectBlockComment(index, collected);
                break;
            } else {
                break;
            }
        }

        if (collected.isEmpty()) {
            return Optional.empty();
        }
        Collections.reverse(collected);
        return Optional.of(String.join("\n", collected));
    }

    // adds the lines of the block ending at `last` bottom-up, or nothing if it never opens
    private void collectBlockComment(int last, List<String> collected) {
        int first = last;
        while (first >= 0 && !lines.get(first).strip().startsWith("/*")) {
            first--;
        }
        if (first < 0) {
            return;
        }
        for (int i = last; i >= first; i--) {
            addIfPresent(collected, blockLine(lines.get(i).strip()));
        }
    }

    private static String blockLine(String line) {
        var text = line;
        if (text.startsWith("/**")) {
            text = text.substring(3);
        } else if (text.startsWith("/*")) {
            text = text.substring(2);
        }
        if (text.endsWith("*/")) {
            text = text.substring(0, text.length() - 2);
        }
        text = text.strip();
        if (text.startsWith("*")) {
            text = text.substring(1);
        }
        return text;
    }

    private static void addIfPresent(List<String> collected, String text) {
        var stripped = text.strip();
        if (!stripped.isEmpty()) {
            collected.add(stripped);
        }
    }
}
