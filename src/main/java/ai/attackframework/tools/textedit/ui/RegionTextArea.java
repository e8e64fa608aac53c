package ai.attackframework.tools.textedit.ui;

import ai.attackframework.tools.textedit.ui.text.Doc;
import ai.attackframework.tools.textedit.ui.text.HighlighterManager;
import ai.attackframework.tools.textedit.ui.text.PersistentSelectionCaret;
import ai.attackframework.tools.textedit.ui.text.RegionHighlightPainter;
import ai.attackframework.tools.textedit.ui.text.SwingEventPump;
import ai.attackframework.tools.textedit.ui.text.SwingTextBuffer;
import ai.attackframework.tools.textedit.ui.text.Tints;
import ai.attackframework.tools.textedit.ui.text.WhitespacePainter;
import ai.attackframework.tools.textedit.utils.Logger;
import ai.attackframework.tools.textedit.utils.config.EditorSettings;
import ai.attackframework.tools.textedit.utils.text.EventPump;
import ai.attackframework.tools.textedit.utils.text.FindReplaceEngine;
import ai.attackframework.tools.textedit.utils.text.FindRequest;
import ai.attackframework.tools.textedit.utils.text.RegionTracker;
import ai.attackframework.tools.textedit.utils.text.TextRange;

import javax.swing.JTextArea;
import javax.swing.UIManager;
import javax.swing.event.DocumentListener;
import javax.swing.text.Document;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics;
import java.io.Serial;
import java.util.List;
import java.util.Objects;

/**
 * Text area with an active region that confines find/replace, painted as a tint, plus optional
 * whitespace and line-break glyphs.
 *
 * <p><strong>Region:</strong> selecting text that contains whitespace while the area has focus makes
 * that selection the region; a single-word selection or a plain click resets it to the whole
 * document. Selections made by find/replace never change the region.</p>
 *
 * <p><strong>Threading:</strong> EDT only. {@link #replaceAll(String, String, boolean)} yields to the
 * event queue between substitutions; editing is disabled and nested find/replace calls are refused
 * while it runs.</p>
 */
public class RegionTextArea extends JTextArea {

    @Serial
    private static final long serialVersionUID = 1L;

    private final transient RegionTracker tracker = new RegionTracker();
    private final transient SwingTextBuffer buffer;
    private final transient RegionHighlightPainter regionPainter;
    private final transient HighlighterManager regionHighlight;
    private final transient DocumentListener editListener;

    private transient EventPump eventPump = new SwingEventPump();
    private int tintFactor;
    private boolean drawWhitespace;
    private boolean programmaticSelection;
    private boolean replaceAllRunning;

    public RegionTextArea() {
        this(EditorSettings.defaults());
    }

    public RegionTextArea(EditorSettings settings) {
        final EditorSettings s = settings == null ? EditorSettings.defaults() : settings;
        setCaret(new PersistentSelectionCaret());
        setFont(new Font(Font.MONOSPACED, Font.PLAIN, 12));
        setWrapStyleWord(true);

        buffer = new SwingTextBuffer(this);
        tintFactor = s.regionTintFactor();
        regionPainter = new RegionHighlightPainter(regionTint());
        regionHighlight = new HighlighterManager(this, regionPainter);

        editListener = Doc.onEdit(new Doc.EditListener() {
            @Override public void inserted(int offset, int length) {
                tracker.inserted(offset, length, getDocument().getLength());
                refreshRegionHighlight();
            }
            @Override public void removed(int offset, int length) {
                tracker.removed(offset, length, getDocument().getLength());
                refreshRegionHighlight();
            }
        });
        getDocument().addDocumentListener(editListener);
        addPropertyChangeListener("document", e -> {
            if (e.getOldValue() instanceof Document old) old.removeDocumentListener(editListener);
            if (e.getNewValue() instanceof Document doc) {
                doc.addDocumentListener(editListener);
                tracker.reset(doc.getLength());
                refreshRegionHighlight();
            }
        });
        addCaretListener(e -> saveRegionBounds());

        applySettings(s);
        tracker.reset(getDocument().getLength());
    }

    /** Apply display settings; the case default belongs to the find bar. */
    public void applySettings(EditorSettings settings) {
        Objects.requireNonNull(settings, "settings");
        setLineWrap(settings.lineWrap());
        tintFactor = settings.regionTintFactor();
        regionPainter.setColor(regionTint());
        setDrawWhitespace(settings.drawWhitespace());
    }

    // ---- Region ----

    /** Active region, normalized; the whole document when no region is set. */
    public TextRange regionBounds() {
        return tracker.bounds();
    }

    /** {@code true} when the region covers the whole document and no tint is painted. */
    public boolean isEntireRegion() {
        return tracker.isEntireDocument();
    }

    /** Whether selection changes should currently become the region. */
    protected boolean isRegionCaptureEnabled() {
        return hasFocus();
    }

    private void saveRegionBounds() {
        if (programmaticSelection) return;
        final boolean changed = tracker.capture(
                isRegionCaptureEnabled(), buffer.cursor(), getSelectedText(), getDocument().getLength());
        if (changed) {
            Logger.internalTrace("region -> " + tracker.bounds() + (tracker.isEntireDocument() ? " (entire)" : ""));
            refreshRegionHighlight();
        }
    }

    private void refreshRegionHighlight() {
        if (regionHighlight == null) return;
        if (tracker.isEntireDocument()) {
            regionHighlight.clear();
        } else {
            regionHighlight.show(List.of(tracker.bounds()));
        }
        repaint();
    }

    // ---- Find / replace ----

    /**
     * One find or find-and-replace step inside the region.
     *
     * <p>A replacement happens only when the whole selection matches {@code search}; a selection
     * that merely contains a match is not replaced, the next match is selected instead.</p>
     *
     * @param backwards   search toward the document start
     * @param replace     substitute the selection if it already matches
     * @param matchCase   case-sensitive matching
     * @param search      regular expression
     * @param replacement literal replacement text
     * @return {@code true} if a match was selected or replaced
     * @throws java.util.regex.PatternSyntaxException if {@code search} is not a valid pattern
     */
    public boolean findReplace(boolean backwards, boolean replace, boolean matchCase, String search, String replacement) {
        return findReplace(new FindRequest(search, replacement, backwards, replace, matchCase));
    }

    /** @see #findReplace(boolean, boolean, boolean, String, String) */
    public boolean findReplace(FindRequest request) {
        if (replaceAllRunning) return false;
        programmaticSelection = true;
        try {
            return FindReplaceEngine.findReplace(buffer, tracker.bounds(), request);
        } finally {
            programmaticSelection = false;
        }
    }

    /**
     * Replace every literal occurrence of {@code search} inside the region.
     *
     * @return number of substitutions, {@code 0} when nothing matched
     */
    public int replaceAll(String search, String replacement, boolean matchCase) {
        if (replaceAllRunning) return 0;
        final boolean editable = isEditable();
        replaceAllRunning = true;
        programmaticSelection = true;
        setEditable(false);
        try {
            return FindReplaceEngine.replaceAll(buffer, tracker.bounds(), search, replacement, matchCase, eventPump);
        } finally {
            setEditable(editable);
            programmaticSelection = false;
            replaceAllRunning = false;
        }
    }

    /** Yield strategy used by {@link #replaceAll(String, String, boolean)}. */
    public void setEventPump(EventPump eventPump) {
        this.eventPump = eventPump == null ? EventPump.NONE : eventPump;
    }

    // ---- Painting ----

    public boolean isDrawWhitespace() {
        return drawWhitespace;
    }

    public void setDrawWhitespace(boolean drawWhitespace) {
        if (this.drawWhitespace == drawWhitespace) return;
        this.drawWhitespace = drawWhitespace;
        repaint();
    }

    @Override
    public void updateUI() {
        super.updateUI();
        if (regionPainter != null) regionPainter.setColor(regionTint());
    }

    @Override
    protected void paintComponent(Graphics g) {
        super.paintComponent(g);
        if (drawWhitespace) {
            WhitespacePainter.paint(g, this);
        }
    }

    private Color regionTint() {
        Color base = getSelectionColor();
        if (base == null) base = UIManager.getColor("TextArea.selectionBackground");
        if (base == null) base = new Color(180, 200, 255);
        return Tints.lighter(base, tintFactor);
    }
}
