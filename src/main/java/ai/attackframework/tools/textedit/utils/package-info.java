/**
 * Common utilities shared across the editor.
 *
 * <p>Includes logging ({@link ai.attackframework.tools.textedit.utils.Logger}), version access and
 * regex helpers. These classes are UI-agnostic.</p>
 */
package ai.attackframework.tools.textedit.utils;
