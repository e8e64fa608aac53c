package ai.attackframework.tools.textedit.ui;

import java.io.Serial;

/**
 * Headless stand-in for a focused editor: focus cannot be acquired without a display, so region
 * capture is switched explicitly.
 */
class FocusedRegionTextArea extends RegionTextArea {

    @Serial
    private static final long serialVersionUID = 1L;

    private boolean focused = true;

    void setFocused(boolean focused) {
        this.focused = focused;
    }

    @Override
    protected boolean isRegionCaptureEnabled() {
        return focused;
    }
}
