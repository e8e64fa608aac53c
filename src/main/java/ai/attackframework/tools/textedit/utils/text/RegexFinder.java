package ai.attackframework.tools.textedit.utils.text;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Directional single-match search over a text snapshot.
 *
 * <ul>
 *   <li>Forward: the first match starting at or after {@code from}.</li>
 *   <li>Backward: the nearest match starting strictly before {@code from}; matches may extend
 *       past {@code from}. Lookbehind and {@code ^} see the text before the candidate start.
 *       {@code from} may be {@code text.length() + 1} so an empty match at the very end is tried.</li>
 * </ul>
 *
 * <p>Results are not clipped; callers decide what to do with a match outside their region.</p>
 */
public final class RegexFinder {

    private RegexFinder() {}

    /**
     * @return the match, or {@code null} if there is none
     */
    public static TextRange forward(Pattern pattern, CharSequence text, int from) {
        Objects.requireNonNull(pattern, "pattern");
        if (from < 0 || from > text.length()) return null;
        final Matcher m = pattern.matcher(text);
        return m.find(from) ? new TextRange(m.start(), m.end()) : null;
    }

    /**
     * @param floor lowest start offset worth trying; candidates before it are not examined
     * @return the match, or {@code null} if there is none
     */
    public static TextRange backward(Pattern pattern, CharSequence text, int from, int floor) {
        Objects.requireNonNull(pattern, "pattern");
        final Matcher m = pattern.matcher(text);
        m.useTransparentBounds(true);
        m.useAnchoringBounds(false);
        final int lowest = Math.max(0, floor);
        for (int i = Math.min(from, text.length() + 1) - 1; i >= lowest; i--) {
            m.region(i, text.length());
            if (m.lookingAt()) {
                return new TextRange(m.start(), m.end());
            }
        }
        return null;
    }
}
