package ai.attackframework.tools.textedit.ui.text;

import ai.attackframework.tools.textedit.utils.Logger;

import javax.swing.text.BadLocationException;
import javax.swing.text.Highlighter;
import javax.swing.text.JTextComponent;
import javax.swing.text.Utilities;
import java.awt.Color;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Shape;
import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Paints the active region as a tint under the text, one rectangle per visual row.
 *
 * <p>Rows are discovered with {@link Utilities#getRowStart}/{@link Utilities#getRowEnd}, so soft
 * wrapped lines get their own rectangle. The highlighter calls this before the text is drawn.</p>
 */
public final class RegionHighlightPainter implements Highlighter.HighlightPainter {

    private volatile Color color;

    public RegionHighlightPainter(Color color) {
        this.color = Objects.requireNonNull(color, "color");
    }

    public Color getColor() {
        return color;
    }

    public void setColor(Color color) {
        this.color = Objects.requireNonNull(color, "color");
    }

    @Override
    public void paint(Graphics g, int p0, int p1, Shape bounds, JTextComponent c) {
        final List<Rectangle2D> rects = visualRects(c, p0, p1);
        if (rects.isEmpty()) return;
        final Graphics2D g2 = (Graphics2D) g.create();
        try {
            g2.setColor(color);
            for (Rectangle2D r : rects) {
                g2.fill(r);
            }
        } finally {
            g2.dispose();
        }
    }

    /**
     * Rectangles covering {@code [p0, p1)} in view coordinates; empty when the component has no
     * layout yet.
     */
    public static List<Rectangle2D> visualRects(JTextComponent c, int p0, int p1) {
        final int start = Math.min(p0, p1);
        final int end = Math.max(p0, p1);
        try {
            final Rectangle2D startRect = c.modelToView2D(start);
            final Rectangle2D endRect = c.modelToView2D(end);
            if (startRect == null || endRect == null) return List.of();

            final List<RegionGeometry.VisualRow> rows = new ArrayList<>();
            int rowStart = Utilities.getRowStart(c, start);
            while (rowStart >= 0) {
                final int rowEnd = Utilities.getRowEnd(c, rowStart);
                if (rowEnd < 0) break;
                final Rectangle2D left = c.modelToView2D(rowStart);
                final Rectangle2D right = c.modelToView2D(rowEnd);
                rows.add(new RegionGeometry.VisualRow(left.getY(), left.getHeight(), left.getX(), right.getX()));
                if (end <= rowEnd || rowEnd + 1 > c.getDocument().getLength()) break;
                final int next = rowEnd + 1;
                // "end" at the very start of the next row belongs to that row
                rowStart = Utilities.getRowStart(c, next);
                if (rowStart <= rowEnd) break;
            }
            return RegionGeometry.rects(rows, startRect.getX(), endRect.getX());
        } catch (BadLocationException e) {
            Logger.internalDebug("region geometry skipped: " + e.getMessage());
            return List.of();
        }
    }
}
