package ai.attackframework.tools.textedit.ui.text;

import javax.swing.event.DocumentEvent;
import javax.swing.event.DocumentListener;
import java.util.Objects;

/**
 * Adapters that reduce boilerplate when wiring document change events.
 *
 * <p>Attribute-only changes ({@code changedUpdate}) are not edits and are ignored by
 * {@link #onEdit(EditListener)}.</p>
 */
public final class Doc {

    /** Receives offset/length of content edits. */
    public interface EditListener {
        void inserted(int offset, int length);
        void removed(int offset, int length);
    }

    private Doc() {}

    /**
     * Return a {@link DocumentListener} that invokes the given action on any document change.
     *
     * @param action action to invoke
     * @return a listener delegating all events to {@code action}
     */
    public static DocumentListener onChange(Runnable action) {
        Objects.requireNonNull(action, "action");
        return new DocumentListener() {
            @Override public void insertUpdate(DocumentEvent e) { action.run(); }
            @Override public void removeUpdate(DocumentEvent e) { action.run(); }
            @Override public void changedUpdate(DocumentEvent e) { action.run(); }
        };
    }

    /**
     * Return a {@link DocumentListener} that forwards insertions and removals with their extent.
     *
     * @param listener edit callback
     * @return a listener translating document events to {@code listener}
     */
    public static DocumentListener onEdit(EditListener listener) {
        Objects.requireNonNull(listener, "listener");
        return new DocumentListener() {
            @Override public void insertUpdate(DocumentEvent e) { listener.inserted(e.getOffset(), e.getLength()); }
            @Override public void removeUpdate(DocumentEvent e) { listener.removed(e.getOffset(), e.getLength()); }
            @Override public void changedUpdate(DocumentEvent e) { /* attributes only */ }
        };
    }
}
