package ai.attackframework.tools.textedit.utils.text;

/**
 * Half-open range of character offsets {@code [start, end)}, always normalized so
 * {@code start <= end}. Used for the active region and for match results.
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        }
    }

    /** Range between two offsets given in any order. */
    public static TextRange of(int a, int b) {
        return new TextRange(Math.min(a, b), Math.max(a, b));
    }

    /** The whole document {@code [0, docLength)}. */
    public static TextRange whole(int docLength) {
        return new TextRange(0, Math.max(0, docLength));
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /** {@code true} when {@code other} lies fully inside this range. */
    public boolean contains(TextRange other) {
        return other != null && other.start >= start && other.end <= end;
    }

    /** This range with both bounds limited to {@code [0, docLength]}. */
    public TextRange clamp(int docLength) {
        int max = Math.max(0, docLength);
        return new TextRange(Math.min(start, max), Math.min(end, max));
    }
}
