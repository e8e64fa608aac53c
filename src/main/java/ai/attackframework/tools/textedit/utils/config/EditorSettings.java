package ai.attackframework.tools.textedit.utils.config;

/**
 * Display and search preferences of the editor.
 *
 * @param drawWhitespace   paint space, tab and line-break glyphs
 * @param lineWrap         soft-wrap long lines at word boundaries
 * @param matchCase        default for the find bar's case toggle
 * @param regionTintFactor how much lighter than the selection colour the region tint is, in
 *                         percent ({@code 100} = unchanged); values below 100 are raised to 100
 */
public record EditorSettings(boolean drawWhitespace, boolean lineWrap, boolean matchCase, int regionTintFactor) {

    public static final int DEFAULT_TINT_FACTOR = 160;

    public EditorSettings {
        if (regionTintFactor < 100) {
            regionTintFactor = 100;
        }
    }

    public static EditorSettings defaults() {
        return new EditorSettings(false, true, false, DEFAULT_TINT_FACTOR);
    }
}
