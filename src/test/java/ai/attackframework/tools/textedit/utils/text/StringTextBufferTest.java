package ai.attackframework.tools.textedit.utils.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StringTextBufferTest {

    @Test
    void edits_shift_cursor_like_a_caret() {
        StringTextBuffer b = new StringTextBuffer("hello world");
        b.setCursor(6, 11);

        b.replace(0, 5, "hi");
        assertThat(b.toString()).isEqualTo("hi world");
        assertThat(b.cursor()).isEqualTo(new Cursor(3, 8));

        b.replace(4, 6, "");
        assertThat(b.cursor()).isEqualTo(new Cursor(3, 6));
    }

    @Test
    void cursor_outside_document_is_rejected() {
        StringTextBuffer b = new StringTextBuffer("abc");
        assertThatThrownBy(() -> b.setCursor(0, 4)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void range_normalizes_and_clamps() {
        assertThat(TextRange.of(7, 2)).isEqualTo(new TextRange(2, 7));
        assertThat(new TextRange(2, 7).clamp(5)).isEqualTo(new TextRange(2, 5));
        assertThat(new TextRange(2, 7).contains(null)).isFalse();
        assertThatThrownBy(() -> new TextRange(3, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
