/**
 * Region-aware text editor: entry point {@link ai.attackframework.tools.textedit.TextEditorApp}.
 */
package ai.attackframework.tools.textedit;
