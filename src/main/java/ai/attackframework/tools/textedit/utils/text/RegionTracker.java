package ai.attackframework.tools.textedit.utils.text;

import java.util.regex.Pattern;

/**
 * Tracks the active region: the part of the document that find/replace and the region tint
 * are confined to.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>While the editor has focus, every selection change proposes the selection as the region.</li>
 *   <li>A selection without whitespace (a single word) is not a region; it is the usual thing to
 *       search for, not to search in.</li>
 *   <li>No region means the whole document; {@link #isEntireDocument()} reports that case.</li>
 *   <li>Edits keep the region on the same text; bounds are always valid offsets.</li>
 * </ul>
 *
 * <p>Not thread-safe; the widget drives it from the EDT.</p>
 */
public final class RegionTracker {

    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private TextRange region = TextRange.whole(0);
    private boolean entire = true;

    /** Current region, normalized. */
    public TextRange bounds() {
        return region;
    }

    /** {@code true} when the region covers the whole document (no tint is painted). */
    public boolean isEntireDocument() {
        return entire;
    }

    /**
     * Recompute the region after a caret or selection change.
     *
     * @param focused      whether the editor currently owns focus; unfocused changes never capture
     * @param cursor       current selection
     * @param selectedText text of the selection (may be {@code null} when nothing is selected)
     * @param docLength    current document length
     * @return {@code true} when the painted region changed and the view should repaint
     */
    public boolean capture(boolean focused, Cursor cursor, String selectedText, int docLength) {
        final TextRange before = region;
        final boolean beforeEntire = entire;

        TextRange candidate = entire ? null : region;
        if (focused && cursor != null) {
            candidate = cursor.range().clamp(docLength);
            if (selectedText == null || !WHITESPACE.matcher(selectedText).find()) {
                candidate = null;
            }
        }
        settle(candidate, docLength);
        return !(before.equals(region) && beforeEntire == entire);
    }

    /**
     * Document grew by {@code length} characters at {@code offset}. Text inserted at the region
     * start or end becomes part of the region.
     */
    public void inserted(int offset, int length, int docLength) {
        if (entire) {
            settle(null, docLength);
            return;
        }
        int start = offset < region.start() ? region.start() + length : region.start();
        int end = offset <= region.end() ? region.end() + length : region.end();
        settle(new TextRange(start, end), docLength);
    }

    /** Document lost {@code [offset, offset + length)}. */
    public void removed(int offset, int length, int docLength) {
        if (entire) {
            settle(null, docLength);
            return;
        }
        int start = afterRemoval(region.start(), offset, length);
        int end = afterRemoval(region.end(), offset, length);
        settle(new TextRange(start, end), docLength);
    }

    /** Drop any region, e.g. after the whole text was replaced. */
    public void reset(int docLength) {
        settle(null, docLength);
    }

    private void settle(TextRange candidate, int docLength) {
        final TextRange all = TextRange.whole(docLength);
        TextRange r = candidate == null ? all : candidate.clamp(docLength);
        if (r.isEmpty()) {
            r = all;
        }
        region = r;
        entire = r.equals(all);
    }

    private static int afterRemoval(int bound, int offset, int length) {
        if (bound <= offset) return bound;
        if (bound < offset + length) return offset;
        return bound - length;
    }
}
