package ai.attackframework.tools.textedit.ui.text;

import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.assertj.core.api.Assertions.assertThat;

class TintsTest {

    @Test
    void factor_of_one_hundred_keeps_colour() {
        Color c = new Color(10, 20, 30);
        assertThat(Tints.lighter(c, 100)).isSameAs(c);
    }

    @Test
    void overflowing_brightness_desaturates() {
        Color lighter = Tints.lighter(new Color(0, 0, 200), 160);

        assertThat(lighter.getBlue()).isEqualTo(255);
        assertThat(lighter.getRed()).isPositive();
        assertThat(lighter.getRed()).isEqualTo(lighter.getGreen());
    }

    @Test
    void alpha_is_preserved() {
        Color lighter = Tints.lighter(new Color(100, 50, 50, 128), 150);
        assertThat(lighter.getAlpha()).isEqualTo(128);
        assertThat(lighter.getRed()).isGreaterThan(100);
    }
}
