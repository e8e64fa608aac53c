package ai.attackframework.tools.textedit.utils.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Replace-all yields to the host once per substitution and never when nothing matched.
 */
class EventPumpYieldTest {

    @Test
    void yields_once_per_substitution() {
        EventPump pump = mock(EventPump.class);
        StringTextBuffer b = new StringTextBuffer("x1 x2 x3");

        int count = FindReplaceEngine.replaceAll(b, null, "x", "y", true, pump);

        assertThat(count).isEqualTo(3);
        verify(pump, times(3)).yieldToHost();
    }

    @Test
    void no_yield_without_matches() {
        EventPump pump = mock(EventPump.class);
        FindReplaceEngine.replaceAll(new StringTextBuffer("abc"), null, "z", "y", true, pump);
        verify(pump, never()).yieldToHost();
    }
}
