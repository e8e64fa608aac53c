package ai.attackframework.tools.textedit.ui.text;

import ai.attackframework.tools.textedit.utils.Regex;

import javax.swing.JCheckBox;
import javax.swing.JLabel;
import javax.swing.SwingConstants;
import javax.swing.event.DocumentListener;
import javax.swing.text.JTextComponent;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.event.ItemListener;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Binds a pattern field (and optional case toggle) to a label that shows ✓ for a pattern that
 * compiles and ✖ with the compiler's message as tooltip otherwise.
 *
 * <ul>
 *   <li>Indicator is hidden while the field is empty.</li>
 *   <li>Indicator width is fixed to the wider glyph to avoid toolbar jitter.</li>
 * </ul>
 */
public final class RegexIndicatorBinder {

    static final String VALID = "✓";
    static final String INVALID = "✖";

    private static final Color GREEN = new Color(0, 153, 0);
    private static final Color RED = new Color(200, 0, 0);

    private RegexIndicatorBinder() {
        // utility
    }

    /**
     * Wire listeners and paint the initial state.
     *
     * @param field            pattern source
     * @param caseToggleOrNull optional case-sensitivity toggle (may be {@code null})
     * @param indicator        target label
     * @return handle that detaches listeners when closed
     */
    public static AutoCloseable bind(JTextComponent field, JCheckBox caseToggleOrNull, JLabel indicator) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(indicator, "indicator");

        final AtomicBoolean installed = new AtomicBoolean(true);
        final Runnable refresh = () -> refresh(field, caseToggleOrNull, indicator);
        final DocumentListener docListener = Doc.onChange(refresh);
        final ItemListener itemListener = e -> refresh.run();

        field.getDocument().addDocumentListener(docListener);
        if (caseToggleOrNull != null) caseToggleOrNull.addItemListener(itemListener);

        indicator.setHorizontalAlignment(SwingConstants.CENTER);
        indicator.setOpaque(false);
        fixWidth(indicator);
        refresh.run();

        return () -> {
            if (!installed.compareAndSet(true, false)) return;
            field.getDocument().removeDocumentListener(docListener);
            if (caseToggleOrNull != null) caseToggleOrNull.removeItemListener(itemListener);
        };
    }

    private static void refresh(JTextComponent field, JCheckBox caseToggle, JLabel indicator) {
        final String txt = field.getText();
        if (txt == null || txt.isEmpty()) {
            indicator.setText("");
            indicator.setToolTipText(null);
            indicator.setVisible(false);
            return;
        }
        final boolean caseSensitive = caseToggle != null && caseToggle.isSelected();
        if (Regex.isValid(txt, caseSensitive, true)) {
            indicator.setForeground(GREEN);
            indicator.setText(VALID);
            indicator.setToolTipText("Valid regex");
        } else {
            indicator.setForeground(RED);
            indicator.setText(INVALID);
            indicator.setToolTipText("Invalid regex");
        }
        indicator.setVisible(true);
        indicator.repaint();
    }

    private static void fixWidth(JLabel indicator) {
        Font font = indicator.getFont();
        if (font == null || !font.canDisplay('✓') || !font.canDisplay('✖')) {
            font = new Font(Font.DIALOG, Font.PLAIN, font == null ? 12 : font.getSize());
            indicator.setFont(font);
        }
        final FontMetrics fm = indicator.getFontMetrics(font);
        final Dimension d = new Dimension(
                Math.max(fm.stringWidth(VALID), fm.stringWidth(INVALID)) + fm.charWidth(' '),
                fm.getHeight());
        indicator.setMinimumSize(d);
        indicator.setPreferredSize(d);
    }
}
