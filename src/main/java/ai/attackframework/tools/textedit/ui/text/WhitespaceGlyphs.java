package ai.attackframework.tools.textedit.ui.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Which glyph marks which whitespace. Pure; no painting.
 *
 * <ul>
 *   <li>{@link #RETURN} after a hard line break that ends a line with content.</li>
 *   <li>{@link #PILCROW} on an empty line.</li>
 *   <li>{@link #SPACE} over spaces, {@link #TAB} over tabs.</li>
 * </ul>
 * Soft wraps and the last line of the document get no break glyph.
 */
public final class WhitespaceGlyphs {

    public static final char RETURN = '↵';
    public static final char PILCROW = '¶';
    public static final char SPACE = '·';
    public static final char TAB = '→';

    /** A glyph to draw over the character at {@code offset} (relative to the line). */
    public record Marker(int offset, char glyph) { }

    private WhitespaceGlyphs() {}

    /**
     * Glyph for the end of a line.
     *
     * @param lineText     text of the line without its terminator
     * @param hasNextLine  whether a hard break follows this line
     * @return the glyph, or {@code 0} when none is drawn
     */
    public static char lineBreak(String lineText, boolean hasNextLine) {
        if (!hasNextLine) return 0;
        return (lineText == null || lineText.isEmpty()) ? PILCROW : RETURN;
    }

    /** Markers for the spaces and tabs of one line. */
    public static List<Marker> inline(String lineText) {
        final List<Marker> out = new ArrayList<>();
        if (lineText == null) return out;
        for (int i = 0; i < lineText.length(); i++) {
            char ch = lineText.charAt(i);
            if (ch == ' ') {
                out.add(new Marker(i, SPACE));
            } else if (ch == '\t') {
                out.add(new Marker(i, TAB));
            }
        }
        return out;
    }
}
