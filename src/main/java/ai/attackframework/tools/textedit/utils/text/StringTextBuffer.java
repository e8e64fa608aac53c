package ai.attackframework.tools.textedit.utils.text;

import java.util.Objects;

/**
 * In-memory {@link TextBuffer} backed by a {@link StringBuilder}.
 *
 * <p>Used by tests and by callers that want find/replace semantics without a Swing component.
 * The cursor is shifted the same way a Swing caret would be on edits.</p>
 */
public final class StringTextBuffer implements TextBuffer {

    private final StringBuilder text;
    private int anchor;
    private int position;

    public StringTextBuffer(String initial) {
        this.text = new StringBuilder(Objects.requireNonNullElse(initial, ""));
    }

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public String text(int start, int end) {
        return text.substring(start, end);
    }

    @Override
    public void replace(int start, int end, String replacement) {
        String r = Objects.requireNonNullElse(replacement, "");
        text.replace(start, end, r);
        anchor = shift(anchor, start, end, r.length());
        position = shift(position, start, end, r.length());
    }

    @Override
    public Cursor cursor() {
        return new Cursor(anchor, position);
    }

    @Override
    public void setCursor(int anchor, int position) {
        checkOffset(anchor);
        checkOffset(position);
        this.anchor = anchor;
        this.position = position;
    }

    @Override
    public String toString() {
        return text.toString();
    }

    private void checkOffset(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + text.length() + "]");
        }
    }

    private static int shift(int offset, int start, int end, int insertedLength) {
        if (offset <= start) return offset;
        if (offset < end) return start + insertedLength;
        return offset + insertedLength - (end - start);
    }
}
