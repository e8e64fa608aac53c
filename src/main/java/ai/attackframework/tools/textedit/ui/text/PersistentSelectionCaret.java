package ai.attackframework.tools.textedit.ui.text;

import javax.swing.text.DefaultCaret;
import java.io.Serial;

/**
 * Caret whose selection stays painted, in the active selection colour, when the component
 * loses focus. Keeps a find result visible while the user works in the find bar.
 */
public class PersistentSelectionCaret extends DefaultCaret {

    @Serial
    private static final long serialVersionUID = 1L;

    // DefaultCaret hides the selection on focus loss through this setter
    @Override
    public void setSelectionVisible(boolean visible) {
        super.setSelectionVisible(true);
    }
}
