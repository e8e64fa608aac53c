package ai.attackframework.tools.textedit.ui.text;

import java.awt.Color;

/**
 * Colour helpers for overlays.
 */
public final class Tints {

    private Tints() {}

    /**
     * A lighter variant of {@code color}: brightness is multiplied by {@code factor / 100}; what
     * overflows the brightness scale is taken out of the saturation instead.
     *
     * @param factor percent, {@code 100} returns the colour unchanged
     */
    public static Color lighter(Color color, int factor) {
        if (factor <= 100) return color;
        float[] hsb = Color.RGBtoHSB(color.getRed(), color.getGreen(), color.getBlue(), null);
        float brightness = hsb[2] * factor / 100f;
        float saturation = hsb[1];
        if (brightness > 1f) {
            saturation = Math.max(0f, saturation - (brightness - 1f));
            brightness = 1f;
        }
        Color rgb = Color.getHSBColor(hsb[0], saturation, brightness);
        return new Color(rgb.getRed(), rgb.getGreen(), rgb.getBlue(), color.getAlpha());
    }
}
