package ai.attackframework.tools.textedit.utils.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.attackframework.tools.textedit.utils.Version;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON marshaling for editor settings import/export.
 * Produces compact JSON with a stable field order; missing fields fall back to
 * {@link EditorSettings#defaults()}.
 */
public final class SettingsJson {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, false);

    private static final String F_VERSION    = "version";
    private static final String F_WHITESPACE = "drawWhitespace";
    private static final String F_WRAP       = "lineWrap";
    private static final String F_CASE       = "matchCase";
    private static final String F_TINT       = "regionTintFactor";

    private SettingsJson() { }

    /** Dedicated runtime exception for settings serialization errors; parse errors are {@link IOException}s. */
    public static final class SettingsJsonException extends RuntimeException {
        public SettingsJsonException(String message, Throwable cause) { super(message, cause); }
    }

    /** Serialize settings; the writing version is recorded for diagnostics only. */
    public static String build(EditorSettings settings) {
        EditorSettings s = settings == null ? EditorSettings.defaults() : settings;
        ObjectNode root = MAPPER.createObjectNode();
        root.put(F_VERSION, Version.get());
        root.put(F_WHITESPACE, s.drawWhitespace());
        root.put(F_WRAP, s.lineWrap());
        root.put(F_CASE, s.matchCase());
        root.put(F_TINT, s.regionTintFactor());
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new SettingsJsonException("Failed to serialize editor settings", e);
        }
    }

    /**
     * Parse settings JSON.
     *
     * @throws IOException if the text is not valid JSON or not an object
     */
    public static EditorSettings parse(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json == null ? "" : json);
        if (root == null || !root.isObject()) {
            throw new IOException("Editor settings must be a JSON object");
        }
        EditorSettings d = EditorSettings.defaults();
        return new EditorSettings(
                root.path(F_WHITESPACE).asBoolean(d.drawWhitespace()),
                root.path(F_WRAP).asBoolean(d.lineWrap()),
                root.path(F_CASE).asBoolean(d.matchCase()),
                root.path(F_TINT).asInt(d.regionTintFactor())
        );
    }

    /** Read settings from a UTF-8 file. */
    public static EditorSettings read(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /** Write settings to a UTF-8 file, creating parent directories as needed. */
    public static void write(Path file, EditorSettings settings) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, build(settings), StandardCharsets.UTF_8);
    }
}
