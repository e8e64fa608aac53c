package ai.attackframework.tools.textedit.ui;

import ai.attackframework.tools.textedit.ui.text.Doc;
import ai.attackframework.tools.textedit.ui.text.RegexIndicatorBinder;
import ai.attackframework.tools.textedit.utils.Logger;
import ai.attackframework.tools.textedit.utils.config.EditorSettings;
import net.miginfocom.swing.MigLayout;

import javax.swing.AbstractAction;
import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JComponent;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JSeparator;
import javax.swing.JTextField;
import javax.swing.KeyStroke;
import javax.swing.SwingConstants;
import javax.swing.UIManager;
import java.awt.event.ActionEvent;
import java.io.Serial;
import java.util.Objects;
import java.util.prefs.Preferences;
import java.util.regex.PatternSyntaxException;

/**
 * Find/replace toolbar driving a {@link RegionTextArea}.
 *
 * <p>Find is always a regular expression; replace-all matches the find text literally. Enter in the
 * find field goes to the next match, Shift+Enter to the previous one, Enter in the replace field
 * replaces the current match or selects the next one. Last texts and toggles persist in {@link Preferences}.</p>
 */
public class FindReplaceBar extends JPanel {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final String MIG_TOOLBAR_INSETS = "insets 6 8 6 8, fillx, novisualpadding, gapx 6";
    private static final String MIG_SEP            = "h 18!, gapx 8";
    private static final String GAP0               = "gapx 0";
    private static final String GAP4               = "gapx 4";

    private static final String ACTION_NEXT    = "find.next";
    private static final String ACTION_PREV    = "find.prev";
    private static final String ACTION_REPLACE = "find.replaceOne";

    static final String PREF_LAST_SEARCH  = "lastSearch";
    static final String PREF_LAST_REPLACE = "lastReplace";
    static final String PREF_MATCH_CASE   = "matchCase";
    static final String PREF_WHITESPACE   = "drawWhitespace";

    private final RegionTextArea target;
    private final transient Preferences prefs;

    private final JTextField findField;
    private final JTextField replaceField;
    private final JCheckBox caseToggle;
    private final JCheckBox whitespaceToggle;
    private final JLabel statusLabel;

    private final transient AutoCloseable indicatorBinding;

    public FindReplaceBar(RegionTextArea target) {
        this(target, EditorSettings.defaults());
    }

    public FindReplaceBar(RegionTextArea target, EditorSettings settings) {
        this(target, settings, Preferences.userRoot().node("ai.attackframework.tools.textedit.ui.FindReplaceBar"));
    }

    /**
     * Constructs and wires the toolbar (EDT).
     *
     * @param settings supplies the case toggle's initial state when {@code prefs} has none stored
     */
    public FindReplaceBar(RegionTextArea target, EditorSettings settings, Preferences prefs) {
        super(new MigLayout(MIG_TOOLBAR_INSETS, "", "[]"));
        this.target = Objects.requireNonNull(target, "target");
        this.prefs = Objects.requireNonNull(prefs, "prefs");
        final EditorSettings s = settings == null ? EditorSettings.defaults() : settings;
        setBorder(BorderFactory.createMatteBorder(0, 0, 1, 0, UIManager.getColor("Separator.foreground")));

        findField = new JTextField(prefs.get(PREF_LAST_SEARCH, ""), 18);
        findField.setName("find.field");
        replaceField = new JTextField(prefs.get(PREF_LAST_REPLACE, ""), 14);
        replaceField.setName("find.replace");

        caseToggle = new JCheckBox("Aa");
        caseToggle.setName("find.case");
        caseToggle.setToolTipText("Match case");
        caseToggle.setSelected(prefs.getBoolean(PREF_MATCH_CASE, s.matchCase()));

        whitespaceToggle = new JCheckBox("¶");
        whitespaceToggle.setName("find.whitespace");
        whitespaceToggle.setToolTipText("Show whitespace");
        whitespaceToggle.setSelected(prefs.getBoolean(PREF_WHITESPACE, target.isDrawWhitespace()));
        target.setDrawWhitespace(whitespaceToggle.isSelected());

        final JLabel regexIndicator = new JLabel();
        regexIndicator.setName("find.regex.indicator");

        JButton prevBtn = new JButton("Prev");
        prevBtn.setName(ACTION_PREV);
        JButton nextBtn = new JButton("Next");
        nextBtn.setName(ACTION_NEXT);
        JButton replaceBtn = new JButton("Replace");
        replaceBtn.setName(ACTION_REPLACE);
        JButton replaceAllBtn = new JButton("Replace all");
        replaceAllBtn.setName("find.replaceAll");

        statusLabel = new JLabel(" ");
        statusLabel.setName("find.status");

        add(new JLabel("Find:"), GAP0);
        add(findField, GAP0);
        add(regexIndicator, GAP4);
        add(caseToggle, GAP4);
        add(prevBtn, GAP4);
        add(nextBtn, GAP4);
        add(new JSeparator(SwingConstants.VERTICAL), MIG_SEP);
        add(new JLabel("Replace:"), GAP0);
        add(replaceField, GAP0);
        add(replaceBtn, GAP4);
        add(replaceAllBtn, GAP4);
        add(new JSeparator(SwingConstants.VERTICAL), MIG_SEP);
        add(whitespaceToggle);
        add(statusLabel, "pushx, growx, gapx 8");

        // Wiring
        findField.getDocument().addDocumentListener(Doc.onChange(() -> prefs.put(PREF_LAST_SEARCH, findField.getText())));
        replaceField.getDocument().addDocumentListener(Doc.onChange(() -> prefs.put(PREF_LAST_REPLACE, replaceField.getText())));
        caseToggle.addActionListener(e -> prefs.putBoolean(PREF_MATCH_CASE, caseToggle.isSelected()));
        whitespaceToggle.addActionListener(e -> {
            prefs.putBoolean(PREF_WHITESPACE, whitespaceToggle.isSelected());
            target.setDrawWhitespace(whitespaceToggle.isSelected());
        });

        bindKey(findField, "ENTER", ACTION_NEXT, () -> step(false, false));
        bindKey(findField, "shift ENTER", ACTION_PREV, () -> step(true, false));
        bindKey(replaceField, "ENTER", ACTION_REPLACE, () -> step(false, true));

        prevBtn.addActionListener(e -> step(true, false));
        nextBtn.addActionListener(e -> step(false, false));
        replaceBtn.addActionListener(e -> step(false, true));
        replaceAllBtn.addActionListener(e -> replaceAll());

        indicatorBinding = RegexIndicatorBinder.bind(findField, caseToggle, regexIndicator);
    }

    @Override
    public void removeNotify() {
        super.removeNotify();
        try { if (indicatorBinding != null) indicatorBinding.close(); }
        catch (Exception ex) { Logger.internalDebug("regex indicator close skipped: " + ex); }
    }

    /** Current status line text ("" when the last step succeeded). */
    public String statusText() {
        return statusLabel.getText().trim();
    }

    // ---- Actions ----

    /**
     * Run one find step. With {@code replace}, a selection that matches is substituted; otherwise
     * the next match is selected so the following press replaces it.
     *
     * @return {@code true} if a match was selected or replaced
     */
    boolean step(boolean backwards, boolean replace) {
        final String search = findField.getText();
        try {
            boolean ok = target.findReplace(backwards, replace, caseToggle.isSelected(), search, replaceField.getText());
            setStatus(ok ? "" : "Not found: " + search);
            return ok;
        } catch (PatternSyntaxException ex) {
            Logger.logWarn("Invalid find pattern '" + search + "': " + ex.getDescription());
            setStatus("Invalid pattern: " + ex.getDescription());
            return false;
        }
    }

    /** Replace all occurrences of the find text in the region. */
    int replaceAll() {
        final String search = findField.getText();
        final int count = target.replaceAll(search, replaceField.getText(), caseToggle.isSelected());
        if (count == 0) {
            setStatus("No occurrences of " + search);
        } else {
            setStatus("Replaced " + count + (count == 1 ? " occurrence" : " occurrences"));
            Logger.logInfo("Replaced " + count + " occurrence(s) of '" + search + "'");
        }
        return count;
    }

    private void setStatus(String text) {
        statusLabel.setText(text == null || text.isEmpty() ? " " : text);
    }

    private static void bindKey(JTextField field, String keyStroke, String actionKey, Runnable action) {
        field.getInputMap(JComponent.WHEN_FOCUSED).put(KeyStroke.getKeyStroke(keyStroke), actionKey);
        field.getActionMap().put(actionKey, new AbstractAction() {
            @Override public void actionPerformed(ActionEvent e) { action.run(); }
        });
    }
}
