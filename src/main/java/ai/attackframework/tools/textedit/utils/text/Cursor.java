package ai.attackframework.tools.textedit.utils.text;

/**
 * Toolkit-neutral selection: the {@code anchor} stays put while {@code position} follows the
 * caret. Their order gives the selection direction.
 */
public record Cursor(int anchor, int position) {

    public static Cursor at(int offset) {
        return new Cursor(offset, offset);
    }

    public int start() {
        return Math.min(anchor, position);
    }

    public int end() {
        return Math.max(anchor, position);
    }

    public boolean hasSelection() {
        return anchor != position;
    }

    public TextRange range() {
        return TextRange.of(anchor, position);
    }
}
