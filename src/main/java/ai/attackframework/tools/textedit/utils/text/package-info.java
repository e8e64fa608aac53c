/**
 * Toolkit-neutral text model and search logic:
 * <ul>
 *   <li>{@code TextRange}, {@code Cursor}, {@code TextBuffer} – offsets, selection and the buffer seam</li>
 *   <li>{@code RegionTracker} – active region bookkeeping across selection and document changes</li>
 *   <li>{@code RegexFinder}, {@code FindReplaceEngine} – region-bounded find, replace and replace-all</li>
 * </ul>
 *
 * <p>No Swing dependencies. The Swing widget adapts itself to {@code TextBuffer}.</p>
 */
package ai.attackframework.tools.textedit.utils.text;
