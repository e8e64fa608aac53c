package ai.attackframework.tools.textedit.ui.text;

import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.List;

/**
 * Rectangles covering a region, one per visual row.
 *
 * <p>Each row is described by its text extent ({@code left}..{@code right}). The region starts at
 * {@code startX} on the first row and ends at {@code endX} on the last:</p>
 * <ul>
 *   <li>single row: {@code startX .. endX}</li>
 *   <li>first of several: {@code startX .. right}</li>
 *   <li>middle rows: {@code left .. right}</li>
 *   <li>last row: {@code left .. endX}</li>
 * </ul>
 * Widths never go negative; an empty middle row yields a zero-width rectangle.
 */
public final class RegionGeometry {

    /** One visual (possibly wrapped) row of text. */
    public record VisualRow(double top, double height, double left, double right) { }

    private RegionGeometry() {}

    public static List<Rectangle2D> rects(List<VisualRow> rows, double startX, double endX) {
        final List<Rectangle2D> out = new ArrayList<>();
        if (rows == null || rows.isEmpty()) return out;

        final int last = rows.size() - 1;
        if (last == 0) {
            out.add(rect(rows.get(0), startX, endX));
            return out;
        }
        out.add(rect(rows.get(0), startX, rows.get(0).right()));
        for (int i = 1; i < last; i++) {
            VisualRow row = rows.get(i);
            out.add(rect(row, row.left(), row.right()));
        }
        out.add(rect(rows.get(last), rows.get(last).left(), endX));
        return out;
    }

    private static Rectangle2D rect(VisualRow row, double x0, double x1) {
        return new Rectangle2D.Double(x0, row.top(), Math.max(0, x1 - x0), row.height());
    }
}
