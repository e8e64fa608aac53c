package ai.attackframework.tools.textedit;

import ai.attackframework.tools.textedit.utils.Logger;
import ai.attackframework.tools.textedit.utils.config.EditorSettings;
import ai.attackframework.tools.textedit.utils.config.SettingsJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextEditorAppTest {

    @Test
    void no_location_means_defaults() {
        assertThat(TextEditorApp.loadSettings(null)).isEqualTo(EditorSettings.defaults());
        assertThat(TextEditorApp.loadSettings("  ")).isEqualTo(EditorSettings.defaults());
    }

    @Test
    void settings_file_is_loaded_and_reported_at_debug(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("editor.json");
        EditorSettings saved = new EditorSettings(true, false, true, 180);
        SettingsJson.write(file, saved);
        List<String> seen = new ArrayList<>();
        Logger.LogListener listener = (level, message) -> seen.add(level + ":" + message);
        Logger.registerListener(listener);
        try {
            assertThat(TextEditorApp.loadSettings(file.toString())).isEqualTo(saved);
        } finally {
            Logger.unregisterListener(listener);
        }
        assertThat(seen).contains("DEBUG:Editor settings loaded from " + file);
    }

    @Test
    void unreadable_settings_fall_back_and_log_error(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "[1, 2]");
        List<String> seen = new ArrayList<>();
        Logger.LogListener listener = (level, message) -> seen.add(level + ":" + message);
        Logger.registerListener(listener);
        try {
            assertThat(TextEditorApp.loadSettings(file.toString())).isEqualTo(EditorSettings.defaults());
        } finally {
            Logger.unregisterListener(listener);
        }
        assertThat(seen).anySatisfy(s -> assertThat(s).startsWith("ERROR:Editor settings not loaded"));
    }
}
