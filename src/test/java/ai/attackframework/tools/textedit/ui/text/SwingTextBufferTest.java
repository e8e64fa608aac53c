package ai.attackframework.tools.textedit.ui.text;

import ai.attackframework.tools.textedit.utils.text.Cursor;
import org.junit.jupiter.api.Test;

import javax.swing.JTextArea;
import javax.swing.SwingUtilities;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SwingTextBufferTest {

    @Test
    void cursor_maps_mark_to_anchor_and_dot_to_position() throws Exception {
        JTextArea area = new JTextArea("alpha beta");
        SwingTextBuffer buffer = new SwingTextBuffer(area);

        runEdt(() -> buffer.setCursor(10, 6));

        assertThat(call(buffer::cursor)).isEqualTo(new Cursor(10, 6));
        assertThat(call(area::getSelectedText)).isEqualTo("beta");
        assertThat(call(() -> area.getCaret().getMark())).isEqualTo(10);
        assertThat(call(() -> area.getCaret().getDot())).isEqualTo(6);
    }

    @Test
    void replace_and_text_operate_on_the_document() throws Exception {
        JTextArea area = new JTextArea("alpha beta");
        SwingTextBuffer buffer = new SwingTextBuffer(area);

        runEdt(() -> buffer.replace(0, 5, "gamma delta"));

        assertThat(call(buffer::length)).isEqualTo(16);
        assertThat(call(() -> buffer.text(6, 11))).isEqualTo("delta");
        assertThat(call(() -> buffer.text())).isEqualTo("gamma delta beta");
    }

    @Test
    void text_outside_document_is_rejected() {
        SwingTextBuffer buffer = new SwingTextBuffer(new JTextArea("abc"));
        assertThatThrownBy(() -> buffer.text(2, 10)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void stale_replace_surfaces_as_illegal_state() {
        SwingTextBuffer buffer = new SwingTextBuffer(new JTextArea("abc"));
        assertThatThrownBy(() -> buffer.replace(5, 6, "x")).isInstanceOf(IllegalStateException.class);
    }

    private static void runEdt(Runnable action) throws Exception {
        if (SwingUtilities.isEventDispatchThread()) {
            action.run();
        } else {
            SwingUtilities.invokeAndWait(action);
        }
    }

    private static <T> T call(Callable<T> c) throws Exception {
        AtomicReference<T> out = new AtomicReference<>();
        AtomicReference<Exception> err = new AtomicReference<>();
        runEdt(() -> {
            try {
                out.set(c.call());
            } catch (Exception e) {
                err.set(e);
            }
        });
        if (err.get() != null) throw err.get();
        return out.get();
    }
}
