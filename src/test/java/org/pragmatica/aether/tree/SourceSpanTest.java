package org.pragmatica.aether.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceSpanTest {

    @Test
    void toEditorRange_subtractsOne() {
        var span = SourceSpan.of(SourceLocation.at(3, 5, 20), SourceLocation.at(3, 10, 25));

        assertThat(span.toEditorRange()).isEqualTo(EditorRange.onLine(2, 4, 9));
    }

    @Test
    void columnWidth_singleLineOnly() {
        var singleLine = SourceSpan.of(SourceLocation.at(1, 3, 2), SourceLocation.at(1, 8, 7));
        var multiLine = SourceSpan.of(SourceLocation.at(1, 3, 2), SourceLocation.at(2, 2, 12));

        assertThat(singleLine.columnWidth()).isEqualTo(5);
        assertThat(multiLine.columnWidth()).isZero();
        assertThat(multiLine.isSingleLine()).isFalse();
    }

    @Test
    void extract_returnsCoveredText() {
        var span = SourceSpan.of(SourceLocation.at(1, 5, 4), SourceLocation.at(1, 10, 9));

        assertThat(span.extract("Set COUNT 1")).isEqualTo("COUNT");
        assertThat(span.length()).isEqualTo(5);
        assertThat(SourceSpan.at(SourceLocation.START).isEmpty()).isTrue();
    }

    @Test
    void fromOneBased_saturatesAtZero() {
        assertThat(EditorPosition.fromOneBased(0, 0)).isEqualTo(EditorPosition.of(0, 0));
        assertThat(EditorPosition.fromOneBased(1, 1)).isEqualTo(EditorPosition.of(0, 0));
        assertThat(EditorPosition.fromOneBased(4, 7)).isEqualTo(EditorPosition.of(3, 6));
    }

    @Test
    void editorPosition_negative_isRejected() {
        assertThatThrownBy(() -> EditorPosition.of(-1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void editorRange_containsIsInclusive() {
        var range = EditorRange.of(EditorPosition.of(1, 4), EditorPosition.of(3, 2));

        assertThat(range.contains(EditorPosition.of(1, 4))).isTrue();
        assertThat(range.contains(EditorPosition.of(2, 100))).isTrue();
        assertThat(range.contains(EditorPosition.of(3, 2))).isTrue();
        assertThat(range.contains(EditorPosition.of(1, 3))).isFalse();
        assertThat(range.contains(EditorPosition.of(3, 3))).isFalse();
    }

    @Test
    void editorRange_isWithin() {
        var outer = EditorRange.of(EditorPosition.of(0, 0), EditorPosition.of(5, 0));
        var inner = EditorRange.onLine(2, 4, 9);

        assertThat(inner.isWithin(outer)).isTrue();
        assertThat(outer.isWithin(inner)).isFalse();
    }
}
