package ai.attackframework.tools.textedit.ui.text;

import ai.attackframework.tools.textedit.utils.Logger;
import ai.attackframework.tools.textedit.utils.text.TextRange;

import javax.swing.text.BadLocationException;
import javax.swing.text.Highlighter;
import javax.swing.text.Highlighter.HighlightPainter;
import javax.swing.text.JTextComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Owns a set of highlight tags drawn with one painter on a {@link JTextComponent}.
 *
 * <h3>Contract</h3>
 * <ul>
 *   <li>{@link #show(Collection)} replaces all previously shown ranges.</li>
 *   <li>{@link #clear()} removes the tags; safe to call repeatedly.</li>
 *   <li>Ranges outside the document are skipped.</li>
 * </ul>
 *
 * <p>Callers update from the EDT.</p>
 */
public final class HighlighterManager {

    private final JTextComponent component;
    private final HighlightPainter painter;
    private final List<Object> tags = new ArrayList<>();

    public HighlighterManager(JTextComponent component, HighlightPainter painter) {
        this.component = Objects.requireNonNull(component, "component");
        this.painter = Objects.requireNonNull(painter, "painter");
    }

    /**
     * Show exactly the given ranges.
     *
     * @return number of highlights now present
     */
    public int show(Collection<TextRange> ranges) {
        clear();
        if (ranges == null) return 0;
        final Highlighter h = component.getHighlighter();
        final int length = component.getDocument().getLength();
        for (TextRange r : ranges) {
            if (r == null || r.end() > length) continue;
            try {
                tags.add(h.addHighlight(r.start(), r.end(), painter));
            } catch (BadLocationException ex) {
                Logger.internalDebug("highlight skipped for " + r + ": " + ex.getMessage());
            }
        }
        return tags.size();
    }

    /** Remove previously created highlights. */
    public void clear() {
        final Highlighter h = component.getHighlighter();
        for (Object tag : tags) {
            h.removeHighlight(tag);
        }
        tags.clear();
    }

    /** Number of highlights currently owned. */
    public int size() {
        return tags.size();
    }
}
