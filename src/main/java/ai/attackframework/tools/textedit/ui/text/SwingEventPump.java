package ai.attackframework.tools.textedit.ui.text;

import ai.attackframework.tools.textedit.utils.text.EventPump;

import java.awt.EventQueue;
import java.awt.SecondaryLoop;
import java.awt.Toolkit;

/**
 * {@link EventPump} that lets the AWT event queue drain pending events while a bulk edit runs on
 * the EDT.
 *
 * <p>A {@link SecondaryLoop} dispatches events until the exit request posted behind them runs.
 * Off the EDT this pump does nothing.</p>
 */
public final class SwingEventPump implements EventPump {

    @Override
    public void yieldToHost() {
        if (!EventQueue.isDispatchThread()) return;
        final SecondaryLoop loop = Toolkit.getDefaultToolkit().getSystemEventQueue().createSecondaryLoop();
        EventQueue.invokeLater(loop::exit);
        loop.enter();
    }
}
