package ai.attackframework.tools.textedit.utils.text;

import ai.attackframework.tools.textedit.utils.Logger;
import ai.attackframework.tools.textedit.utils.Regex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Find, replace and replace-all confined to a region of a {@link TextBuffer}.
 *
 * <h3>Find / replace step</h3>
 * <ul>
 *   <li>An empty pattern finds nothing.</li>
 *   <li>If the selection already matches the whole pattern and a replacement is requested, the
 *       selection is substituted and the cursor surrounds the inserted text.</li>
 *   <li>Otherwise the search starts at the selection end (forward) or start (backward) and wraps
 *       once to the opposite region edge.</li>
 *   <li>A match reaching outside the region counts as not found.</li>
 * </ul>
 *
 * <h3>Zero-width matches</h3>
 * Forward search steps one character past the origin, restarting at the region start when that
 * passes the region end. Backward search already starts strictly before the origin, and only
 * steps back once more when the empty match sits on the line end right before the origin.
 *
 * <p>An empty last line (document ending in a line break) is a line like any other, so
 * {@code ^$} finds it.</p>
 *
 * <p>Absence of a match is reported as {@code false} / {@code 0}. Invalid patterns throw
 * {@link java.util.regex.PatternSyntaxException}.</p>
 */
public final class FindReplaceEngine {

    private FindReplaceEngine() {}

    /**
     * Run one find or find-and-replace step.
     *
     * @param buffer  target buffer; its cursor is read and updated
     * @param region  active region
     * @param request what to search for and how
     * @return {@code true} if a match was selected or a replacement was made
     */
    public static boolean findReplace(TextBuffer buffer, TextRange region, FindRequest request) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(request, "request");
        if (request.isBlank()) return false;

        final Pattern pattern = Regex.compile(request.search(), request.matchCase(), true);
        final TextRange bounds = (region == null ? TextRange.whole(buffer.length()) : region).clamp(buffer.length());
        final Cursor sel = buffer.cursor();

        if (request.replace() && pattern.matcher(buffer.text(sel.start(), sel.end())).matches()) {
            final String replacement = request.replacementOrEmpty();
            buffer.replace(sel.start(), sel.end(), replacement);
            buffer.setCursor(sel.start() + replacement.length(), sel.start());
            buffer.revealCursor();
            Logger.internalTrace("replace at " + sel.start() + " len=" + sel.range().length()
                    + " -> " + replacement.length());
            return true;
        }

        final String text = searchable(buffer.text());
        final boolean backwards = request.backwards();
        final int origin = backwards ? sel.start() : sel.end();

        TextRange found = search(pattern, text, origin, backwards, bounds);
        if (found != null && found.isEmpty()) {
            found = skipEmptyMatch(pattern, text, origin, backwards, bounds, found);
        }

        if (!bounds.contains(found)) {
            // backward restart is exclusive; one past the end lets an empty match at the region end count
            final int restart = backwards ? bounds.end() + 1 : bounds.start();
            found = search(pattern, text, restart, backwards, bounds);
            if (backwards && found != null && !found.isEmpty() && found.start() == bounds.end()) {
                found = search(pattern, text, bounds.end(), true, bounds);
            }
            if (!bounds.contains(found)) {
                Logger.internalTrace("find: no match for /" + request.search() + "/ in " + bounds);
                return false;
            }
        }

        buffer.setCursor(found.start(), found.end());
        buffer.revealCursor();
        return true;
    }

    /**
     * Replace every literal occurrence of {@code search}.
     *
     * <p>The scope is the region, or the whole document when the region is empty or its text is
     * exactly the search or replacement text (a leftover selection from a previous find).</p>
     *
     * @param pump yielded to after each substitution
     * @return number of substitutions; {@code 0} means nothing changed
     */
    public static int replaceAll(TextBuffer buffer, TextRange region, String search, String replacement,
                                 boolean matchCase, EventPump pump) {
        Objects.requireNonNull(buffer, "buffer");
        if (search == null || search.isEmpty()) return 0;

        final String r = replacement == null ? "" : replacement;
        final EventPump yielder = pump == null ? EventPump.NONE : pump;
        final int length = buffer.length();
        final TextRange bounds = (region == null ? TextRange.whole(length) : region).clamp(length);
        final String current = buffer.text(bounds.start(), bounds.end());

        final TextRange scope = (bounds.isEmpty() || current.equals(search) || current.equals(r))
                ? TextRange.whole(length)
                : bounds;

        final List<TextRange> hits = new ArrayList<>();
        final Matcher m = Regex.literal(search, matchCase).matcher(buffer.text());
        int from = scope.start();
        while (from <= length && m.find(from) && m.end() <= scope.end()) {
            hits.add(new TextRange(m.start(), m.end()));
            from = m.end();
        }

        final int delta = r.length() - search.length();
        int shift = 0;
        int count = 0;
        for (TextRange hit : hits) {
            buffer.replace(hit.start() + shift, hit.end() + shift, r);
            shift += delta;
            count++;
            yielder.yieldToHost();
        }
        Logger.internalDebug("replaceAll: " + count + " substitution(s) in " + scope);
        return count;
    }

    /**
     * {@code MULTILINE} {@code ^} does not match at the end of input after a trailing line break, so
     * the empty last line of {@code "a\n"} would be unreachable. A second terminator makes that
     * position an ordinary line start; matches running into it end outside every region.
     */
    static String searchable(String text) {
        return text.endsWith("\n") ? text + "\n" : text;
    }

    private static TextRange search(Pattern pattern, String text, int origin, boolean backwards, TextRange bounds) {
        return backwards
                ? RegexFinder.backward(pattern, text, origin, bounds.start())
                : RegexFinder.forward(pattern, text, origin);
    }

    // Backward handling only covers the empty match at the previous line end; see class doc.
    private static TextRange skipEmptyMatch(Pattern pattern, String text, int origin, boolean backwards,
                                            TextRange bounds, TextRange found) {
        if (backwards) {
            final boolean atLineEnd = found.start() == text.length() || text.charAt(found.start()) == '\n';
            if (atLineEnd && origin == found.start() + 1) {
                return RegexFinder.backward(pattern, text, Math.max(origin - 1, bounds.start()), bounds.start());
            }
            return found;
        }
        final int next = origin + 1;
        final int restart = next > bounds.end() ? bounds.start() : next;
        return RegexFinder.forward(pattern, text, restart);
    }
}
