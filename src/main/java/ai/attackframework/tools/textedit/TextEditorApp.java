package ai.attackframework.tools.textedit;

import ai.attackframework.tools.textedit.ui.TextEditPanel;
import ai.attackframework.tools.textedit.utils.Logger;
import ai.attackframework.tools.textedit.utils.Version;
import ai.attackframework.tools.textedit.utils.config.EditorSettings;
import ai.attackframework.tools.textedit.utils.config.SettingsJson;

import javax.swing.JFrame;
import javax.swing.SwingUtilities;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class TextEditorApp {

    static final String SETTINGS_PROPERTY = "textedit.settings";

    private TextEditorApp() {}

    /**
     * Opens the editor window.
     *
     * <p>Optional first argument: a UTF-8 file to load. Settings are read from the JSON file named by
     * {@code -Dtextedit.settings}, falling back to defaults when absent or unreadable.</p>
     */
    public static void main(String[] args) {
        final EditorSettings settings = loadSettings(System.getProperty(SETTINGS_PROPERTY));
        final Path file = args.length > 0 ? Path.of(args[0]) : null;
        SwingUtilities.invokeLater(() -> open(settings, file));
    }

    static EditorSettings loadSettings(String location) {
        if (location == null || location.isBlank()) return EditorSettings.defaults();
        try {
            EditorSettings settings = SettingsJson.read(Path.of(location));
            Logger.logDebug("Editor settings loaded from " + location);
            return settings;
        } catch (IOException | RuntimeException e) {
            Logger.logError("Editor settings not loaded from " + location + ", using defaults", e);
            return EditorSettings.defaults();
        }
    }

    private static void open(EditorSettings settings, Path file) {
        final String version = Version.get();
        try {
            TextEditPanel panel = new TextEditPanel(settings);
            if (file != null) {
                panel.textArea().setText(Files.readString(file, StandardCharsets.UTF_8));
                panel.textArea().setCaretPosition(0);
            }
            JFrame frame = new JFrame(file == null ? "Text Editor" : "Text Editor - " + file.getFileName());
            frame.setDefaultCloseOperation(JFrame.DISPOSE_ON_CLOSE);
            frame.setContentPane(panel);
            frame.pack();
            frame.setLocationRelativeTo(null);
            frame.setVisible(true);
            Logger.logInfo("Text editor v" + version + " started");
        } catch (IOException e) {
            Logger.logError("Could not open " + file + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            Logger.logError("Text editor v" + version + " failed to start: " + e.getMessage(), e);
        }
    }
}
