package ai.attackframework.tools.textedit.ui.text;

import ai.attackframework.tools.textedit.utils.Logger;
import ai.attackframework.tools.textedit.utils.text.Cursor;
import ai.attackframework.tools.textedit.utils.text.TextBuffer;

import javax.swing.text.AbstractDocument;
import javax.swing.text.BadLocationException;
import javax.swing.text.Caret;
import javax.swing.text.Document;
import javax.swing.text.JTextComponent;
import java.awt.Rectangle;
import java.awt.geom.Rectangle2D;
import java.util.Objects;

/**
 * {@link TextBuffer} over a {@link JTextComponent}'s document and caret.
 *
 * <p>The caret's mark is the anchor and its dot the position. Reads outside the document throw
 * {@link IndexOutOfBoundsException} per the {@link TextBuffer} contract. A failed edit can only come
 * from offsets computed against a stale snapshot and surfaces as {@link IllegalStateException}.
 * EDT only.</p>
 */
public final class SwingTextBuffer implements TextBuffer {

    private final JTextComponent component;

    public SwingTextBuffer(JTextComponent component) {
        this.component = Objects.requireNonNull(component, "component");
    }

    @Override
    public int length() {
        return component.getDocument().getLength();
    }

    @Override
    public String text(int start, int end) {
        try {
            return component.getDocument().getText(start, end - start);
        } catch (BadLocationException e) {
            throw new IndexOutOfBoundsException("range [" + start + ", " + end + ") outside document: " + e.getMessage());
        }
    }

    @Override
    public void replace(int start, int end, String replacement) {
        final Document doc = component.getDocument();
        try {
            if (doc instanceof AbstractDocument ad) {
                ad.replace(start, end - start, replacement, null);
            } else {
                doc.remove(start, end - start);
                doc.insertString(start, replacement, null);
            }
        } catch (BadLocationException e) {
            throw new IllegalStateException("replace [" + start + ", " + end + ") failed", e);
        }
    }

    @Override
    public Cursor cursor() {
        final Caret caret = component.getCaret();
        return new Cursor(caret.getMark(), caret.getDot());
    }

    @Override
    public void setCursor(int anchor, int position) {
        final Caret caret = component.getCaret();
        caret.setDot(anchor);
        caret.moveDot(position);
    }

    @Override
    public void revealCursor() {
        try {
            Rectangle2D r = component.modelToView2D(component.getCaret().getDot());
            if (r != null) {
                Rectangle bounds = r.getBounds();
                component.scrollRectToVisible(bounds);
            }
        } catch (BadLocationException e) {
            Logger.internalDebug("revealCursor skipped: " + e.getMessage());
        }
    }
}
