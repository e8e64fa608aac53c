package ai.attackframework.tools.textedit.ui.text;

import ai.attackframework.tools.textedit.ui.text.WhitespaceGlyphs.Marker;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WhitespaceGlyphsTest {

    @Test
    void line_break_glyph_depends_on_line_content() {
        assertThat(WhitespaceGlyphs.lineBreak("text", true)).isEqualTo('↵');
        assertThat(WhitespaceGlyphs.lineBreak("", true)).isEqualTo('¶');
    }

    @Test
    void last_line_gets_no_break_glyph() {
        assertThat(WhitespaceGlyphs.lineBreak("text", false)).isEqualTo((char) 0);
        assertThat(WhitespaceGlyphs.lineBreak("", false)).isEqualTo((char) 0);
    }

    @Test
    void spaces_and_tabs_are_marked_in_place() {
        assertThat(WhitespaceGlyphs.inline("a b\tc  "))
                .containsExactly(
                        new Marker(1, '·'),
                        new Marker(3, '→'),
                        new Marker(5, '·'),
                        new Marker(6, '·'));
        assertThat(WhitespaceGlyphs.inline("plain")).isEmpty();
        assertThat(WhitespaceGlyphs.inline(null)).isEmpty();
    }
}
