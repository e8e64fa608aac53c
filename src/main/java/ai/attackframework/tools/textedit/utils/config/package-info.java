/**
 * Editor settings model and JSON import/export (Jackson).
 */
package ai.attackframework.tools.textedit.utils.config;
