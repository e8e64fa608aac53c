package ai.attackframework.tools.textedit.utils.text;

import ai.attackframework.tools.textedit.utils.Regex;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class RegexFinderTest {

    @Test
    void forward_sees_line_anchors() {
        Pattern p = Regex.compile("^foo", true, true);
        assertThat(RegexFinder.forward(p, "a foo\nfoo", 0)).isEqualTo(new TextRange(6, 9));
    }

    @Test
    void forward_out_of_range_origin_finds_nothing() {
        assertThat(RegexFinder.forward(Pattern.compile("a"), "abc", 4)).isNull();
        assertThat(RegexFinder.forward(Pattern.compile("a"), "abc", -1)).isNull();
    }

    @Test
    void backward_starts_strictly_before_origin_and_sees_lookbehind() {
        Pattern p = Pattern.compile("(?<=x)foo");
        assertThat(RegexFinder.backward(p, "xfoo foo", 8, 0)).isEqualTo(new TextRange(1, 4));
        assertThat(RegexFinder.backward(Pattern.compile("foo"), "foo", 0, 0)).isNull();
    }

    @Test
    void backward_respects_floor() {
        Pattern p = Pattern.compile("foo");
        assertThat(RegexFinder.backward(p, "foo bar", 7, 1)).isNull();
        assertThat(RegexFinder.backward(p, "foo bar", 7, 0)).isEqualTo(new TextRange(0, 3));
    }

    @Test
    void backward_past_end_tries_empty_match_at_end() {
        Pattern p = Regex.compile("$", true, true);
        assertThat(RegexFinder.backward(p, "ab", 3, 0)).isEqualTo(new TextRange(2, 2));
        assertThat(RegexFinder.backward(p, "ab", 2, 0)).isNull();
    }
}
