package org.pragmatica.aether.document;

import org.junit.jupiter.api.Test;
import org.pragmatica.aether.tree.EditorPosition;

import static org.assertj.core.api.Assertions.assertThat;

class WordLocatorTest {
    private static final String TEXT = "Set MY_VAR 1\nPRINTLN(MY_VAR)\n";

    @Test
    void wordAt_insideWord_returnsWholeWord() {
        assertThat(WordLocator.wordAt(TEXT, EditorPosition.of(0, 6))).contains("MY_VAR");
    }

    @Test
    void wordAt_atWordBoundaries_touchesWord() {
        assertThat(WordLocator.wordAt(TEXT, EditorPosition.of(1, 0))).contains("PRINTLN");
        assertThat(WordLocator.wordAt(TEXT, EditorPosition.of(1, 7))).contains("PRINTLN");
    }

    @Test
    void wordAt_betweenSymbols_isEmpty() {
        assertThat(WordLocator.wordAt("A + B", EditorPosition.of(0, 2))).isEmpty();
    }

    @Test
    void wordAt_outsideText_isEmpty() {
        assertThat(WordLocator.wordAt(TEXT, EditorPosition.of(5, 0))).isEmpty();
        assertThat(WordLocator.wordAt(TEXT, EditorPosition.of(0, 40))).isEmpty();
    }

    @Test
    void wordAt_countsCodePoints() {
        assertThat(WordLocator.wordAt("\"😀\" ÄPFEL", EditorPosition.of(0, 5))).contains("ÄPFEL");
    }
}
