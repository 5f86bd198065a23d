package org.pragmatica.aether.symbols;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocCommentLocatorTest {

    @Test
    void documentationAbove_contiguousLineComments_joinedTopDown() {
        var locator = DocCommentLocator.forText("// first\n// second\nSet A 1");

        assertThat(locator.documentationAbove(3)).contains("first\nsecond");
    }

    @Test
    void documentationAbove_skipsBlankLines() {
        var locator = DocCommentLocator.forText("// note\n\n\nSet A 1");

        assertThat(locator.documentationAbove(4)).contains("note");
    }

    @Test
    void documentationAbove_stopsAtCode() {
        var locator = DocCommentLocator.forText("// belongs to A\nSet A 1\nSet B 2");

        assertThat(locator.documentationAbove(3)).isEmpty();
    }

    @Test
    void documentationAbove_trailingCommentOnCodeLine_isNotDocumentation() {
        var locator = DocCommentLocator.forText("Set A 1 /* note */\nSet B 2");

        assertThat(locator.documentationAbove(2)).isEmpty();
    }

    @Test
    void documentationAbove_multiLineBlock_strippedOfStars() {
        var locator = DocCommentLocator.forText("""
            /**
             * Maximum retries
             * before giving up
             */
            Set MAX_RETRIES 3
            """);

        assertThat(locator.documentationAbove(5)).contains("Maximum retries\nbefore giving up");
    }

    @Test
    void documentationAbove_multiLineBlock_endsCollection() {
        var locator = DocCommentLocator.forText("// older\n/* one\n   two */\nSet A 1");

        assertThat(locator.documentationAbove(4)).contains("one\ntwo");
    }

    @Test
    void documentationAbove_mixedLineAndSingleLineBlock() {
        var locator = DocCommentLocator.forText("// line\n/* block */\r\nSet A 1");

        assertThat(locator.documentationAbove(3)).contains("line\nblock");
    }

    @Test
    void documentationAbove_firstLine_isEmpty() {
        assertThat(DocCommentLocator.forText("Set A 1").documentationAbove(1)).isEmpty();
    }
}
