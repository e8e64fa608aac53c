package ai.attackframework.tools.textedit.utils;

import java.util.regex.Pattern;

/**
 * Centralized helpers for regex compilation and flag derivation.
 *
 * <p>Find uses multi-line anchors so {@code ^} and {@code $} match at line boundaries, the way a
 * line-oriented editor user expects. Replace-all compiles the search text literally.</p>
 */
public final class Regex {

    private Regex() {
        // utility class
    }

    /**
     * Derive {@link Pattern} flags from UI toggles.
     *
     * @param caseSensitive whether matching is case-sensitive
     * @param multiline     whether {@link Pattern#MULTILINE} should be applied
     * @return integer bitmask for {@link Pattern#compile(String, int)}
     */
    public static int flags(boolean caseSensitive, boolean multiline) {
        int flags = 0;
        if (!caseSensitive) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        if (multiline) {
            flags |= Pattern.MULTILINE;
        }
        return flags;
    }

    /**
     * Compile a pattern with flags derived from the provided toggles.
     *
     * @throws java.util.regex.PatternSyntaxException if the pattern is invalid
     */
    @SuppressWarnings("MagicConstant") // flags(...) only combines valid Pattern flags
    public static Pattern compile(String pattern, boolean caseSensitive, boolean multiline) {
        return Pattern.compile(pattern, flags(caseSensitive, multiline));
    }

    /**
     * Compile {@code text} as a literal (no metacharacters).
     *
     * @param text          literal text to match
     * @param caseSensitive whether the match is case-sensitive
     * @return compiled literal {@link Pattern}
     */
    public static Pattern literal(String text, boolean caseSensitive) {
        return compile(Pattern.quote(text), caseSensitive, false);
    }

    /**
     * Returns whether the supplied pattern compiles with the derived flags.
     *
     * @param pattern       the pattern text (may be {@code null})
     * @param caseSensitive whether the match is case-sensitive
     * @param multiline     whether {@link Pattern#MULTILINE} should be applied
     * @return {@code true} if {@link #compile(String, boolean, boolean)} succeeds
     */
    public static boolean isValid(String pattern, boolean caseSensitive, boolean multiline) {
        if (pattern == null) {
            return false;
        }
        try {
            compile(pattern, caseSensitive, multiline);
            return true;
        } catch (RuntimeException ex) {
            return false;
        }
    }
}
