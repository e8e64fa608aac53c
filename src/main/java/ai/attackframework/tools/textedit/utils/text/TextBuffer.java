package ai.attackframework.tools.textedit.utils.text;

/**
 * Offset-based view of an editable document with a single cursor.
 *
 * <p>The find/replace engine only talks to this interface; the Swing widget adapts its
 * {@code Document} and {@code Caret} to it. Offsets are UTF-16 indices as in {@link String}.</p>
 */
public interface TextBuffer {

    /** Current document length. */
    int length();

    /**
     * Text in {@code [start, end)}.
     *
     * @throws IndexOutOfBoundsException if the range is outside the document
     */
    String text(int start, int end);

    /** Full document text. */
    default String text() {
        return text(0, length());
    }

    /** Replace {@code [start, end)} with {@code replacement}. */
    void replace(int start, int end, String replacement);

    /** Current selection. */
    Cursor cursor();

    /** Move the selection; {@code anchor == position} clears it. */
    void setCursor(int anchor, int position);

    /** Scroll the cursor into view. No-op for buffers without a viewport. */
    default void revealCursor() {
    }
}
