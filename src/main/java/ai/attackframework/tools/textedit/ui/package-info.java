/**
 * Swing UI of the editor.
 *
 * <p>{@link ai.attackframework.tools.textedit.ui.RegionTextArea} is the widget: region tracking,
 * region-bounded find/replace and custom painting. {@link ai.attackframework.tools.textedit.ui.FindReplaceBar}
 * drives it, and {@link ai.attackframework.tools.textedit.ui.TextEditPanel} composes both with a
 * status line fed by the logger.</p>
 *
 * <p>All UI construction and mutation occur on the EDT.</p>
 */
package ai.attackframework.tools.textedit.ui;
