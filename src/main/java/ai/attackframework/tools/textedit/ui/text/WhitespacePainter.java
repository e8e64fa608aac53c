package ai.attackframework.tools.textedit.ui.text;

import ai.attackframework.tools.textedit.utils.Logger;

import javax.swing.text.BadLocationException;
import javax.swing.text.Document;
import javax.swing.text.Element;
import javax.swing.text.JTextComponent;
import java.awt.Color;
import java.awt.FontMetrics;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Point;
import java.awt.Rectangle;
import java.awt.geom.Rectangle2D;

/**
 * Draws whitespace and hard line-break glyphs on top of a text component.
 *
 * <p>Called from {@code paintComponent} after the component painted itself. Only the lines that
 * intersect the clip are visited; the document is never modified.</p>
 */
public final class WhitespacePainter {

    private static final Color GLYPH_COLOR = Color.GRAY;

    private WhitespacePainter() {}

    public static void paint(Graphics g, JTextComponent c) {
        final Rectangle clip = g.getClipBounds() != null ? g.getClipBounds() : c.getVisibleRect();
        final Document doc = c.getDocument();
        final Element root = doc.getDefaultRootElement();
        if (root.getElementCount() == 0) return;

        final int firstOffset = c.viewToModel2D(new Point(clip.x, clip.y));
        final int lastOffset = c.viewToModel2D(new Point(clip.x + clip.width, clip.y + clip.height));
        if (firstOffset < 0 || lastOffset < 0) return;
        final int firstLine = root.getElementIndex(firstOffset);
        final int lastLine = root.getElementIndex(lastOffset);

        final Graphics2D g2 = (Graphics2D) g.create();
        try {
            g2.setColor(GLYPH_COLOR);
            g2.setFont(c.getFont());
            final FontMetrics fm = g2.getFontMetrics();
            for (int i = firstLine; i <= lastLine; i++) {
                paintLine(g2, fm, c, doc, root.getElement(i), i + 1 < root.getElementCount());
            }
        } catch (BadLocationException e) {
            Logger.internalDebug("whitespace glyphs skipped: " + e.getMessage());
        } finally {
            g2.dispose();
        }
    }

    private static void paintLine(Graphics2D g2, FontMetrics fm, JTextComponent c, Document doc,
                                  Element line, boolean hasNextLine) throws BadLocationException {
        final int start = line.getStartOffset();
        final int contentEnd = hasNextLine ? line.getEndOffset() - 1 : Math.min(line.getEndOffset(), doc.getLength());
        final String text = doc.getText(start, contentEnd - start);

        for (WhitespaceGlyphs.Marker m : WhitespaceGlyphs.inline(text)) {
            final Rectangle2D at = c.modelToView2D(start + m.offset());
            final Rectangle2D next = c.modelToView2D(start + m.offset() + 1);
            if (at == null) continue;
            final String glyph = String.valueOf(m.glyph());
            // centre over the whitespace cell; next may sit on the following row when wrapped
            double cell = (next != null && next.getY() == at.getY()) ? next.getX() - at.getX() : fm.charWidth(' ');
            float x = (float) (at.getX() + (cell - fm.stringWidth(glyph)) / 2);
            g2.drawString(glyph, x, (float) (at.getY() + fm.getAscent()));
        }

        final char breakGlyph = WhitespaceGlyphs.lineBreak(text, hasNextLine);
        if (breakGlyph != 0) {
            final Rectangle2D end = c.modelToView2D(contentEnd);
            if (end != null) {
                g2.drawString(String.valueOf(breakGlyph), (float) end.getX(), (float) (end.getY() + fm.getAscent()));
            }
        }
    }
}
