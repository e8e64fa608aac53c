package ai.attackframework.tools.textedit.utils.text;

/**
 * Immutable description of a single find or find-and-replace step.
 *
 * @param search      regular expression to look for
 * @param replacement literal replacement text, used when {@code replace} is {@code true}
 * @param backwards   search toward the document start
 * @param replace     substitute the current selection when it already matches
 * @param matchCase   case-sensitive matching
 */
public record FindRequest(String search, String replacement, boolean backwards, boolean replace, boolean matchCase) {

    public static FindRequest find(String search, boolean backwards, boolean matchCase) {
        return new FindRequest(search, "", backwards, false, matchCase);
    }

    public static FindRequest replace(String search, String replacement, boolean backwards, boolean matchCase) {
        return new FindRequest(search, replacement, backwards, true, matchCase);
    }

    /**
     * Indicates whether the search pattern is empty and therefore not actionable.
     *
     * @return {@code true} if the search is {@code null} or empty
     */
    public boolean isBlank() {
        return search == null || search.isEmpty();
    }

    /** Replacement text, never {@code null}. */
    public String replacementOrEmpty() {
        return replacement == null ? "" : replacement;
    }
}
