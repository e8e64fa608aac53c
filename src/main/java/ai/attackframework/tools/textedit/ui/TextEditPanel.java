package ai.attackframework.tools.textedit.ui;

import ai.attackframework.tools.textedit.utils.Logger;
import ai.attackframework.tools.textedit.utils.config.EditorSettings;

import javax.swing.BorderFactory;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.ScrollPaneConstants;
import javax.swing.SwingUtilities;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.io.Serial;
import java.util.Locale;

/**
 * Editor composition: find bar on top, {@link RegionTextArea} in a scroll pane, and a one-line
 * status strip showing the latest INFO/WARN/ERROR message from {@link Logger}.
 */
public class TextEditPanel extends JPanel implements Logger.LogListener {

    @Serial
    private static final long serialVersionUID = 1L;

    private final RegionTextArea textArea;
    private final FindReplaceBar findBar;
    private final JLabel statusLine;

    /** Caller must invoke on the EDT. */
    public TextEditPanel(EditorSettings settings) {
        setLayout(new BorderLayout());
        setPreferredSize(new Dimension(1000, 640));

        textArea = new RegionTextArea(settings);
        findBar = new FindReplaceBar(textArea, settings);

        JScrollPane scrollPane = new JScrollPane(
                textArea,
                ScrollPaneConstants.VERTICAL_SCROLLBAR_AS_NEEDED,
                ScrollPaneConstants.HORIZONTAL_SCROLLBAR_AS_NEEDED
        );

        statusLine = new JLabel(" ");
        statusLine.setName("editor.status");
        statusLine.setBorder(BorderFactory.createEmptyBorder(2, 8, 2, 8));

        add(findBar, BorderLayout.NORTH);
        add(scrollPane, BorderLayout.CENTER);
        add(statusLine, BorderLayout.SOUTH);
    }

    public RegionTextArea textArea() {
        return textArea;
    }

    public FindReplaceBar findBar() {
        return findBar;
    }

    @Override
    public void addNotify() {
        super.addNotify();
        Logger.registerListener(this);
    }

    @Override
    public void removeNotify() {
        super.removeNotify();
        Logger.unregisterListener(this);
    }

    @Override
    public void onLog(String level, String message) {
        final String lvl = level == null ? "" : level.toUpperCase(Locale.ROOT);
        if ("DEBUG".equals(lvl) || "TRACE".equals(lvl)) return;
        final String text = lvl + ": " + message;
        if (SwingUtilities.isEventDispatchThread()) {
            statusLine.setText(text);
        } else {
            SwingUtilities.invokeLater(() -> statusLine.setText(text));
        }
    }
}
