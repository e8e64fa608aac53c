/**
 * Swing-based text helpers:
 * <ul>
 *   <li>{@code SwingTextBuffer}, {@code SwingEventPump} – adapt a text component to the search engine</li>
 *   <li>{@code RegionHighlightPainter}, {@code RegionGeometry} – region tint per visual row</li>
 *   <li>{@code WhitespacePainter}, {@code WhitespaceGlyphs} – whitespace and line-break glyphs</li>
 *   <li>{@code HighlighterManager}, {@code RegexIndicatorBinder}, {@code Doc} – small wiring helpers</li>
 * </ul>
 *
 * <p>All classes are Swing-oriented and expect to be used on the EDT.</p>
 */
package ai.attackframework.tools.textedit.ui.text;
