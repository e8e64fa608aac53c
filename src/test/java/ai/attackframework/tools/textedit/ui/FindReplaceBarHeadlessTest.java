package ai.attackframework.tools.textedit.ui;

import ai.attackframework.tools.textedit.utils.Logger;
import ai.attackframework.tools.textedit.utils.config.EditorSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JLabel;
import javax.swing.JTextField;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import static ai.attackframework.tools.textedit.ui.SwingTestHarness.click;
import static ai.attackframework.tools.textedit.ui.SwingTestHarness.fireAction;
import static ai.attackframework.tools.textedit.ui.SwingTestHarness.named;
import static ai.attackframework.tools.textedit.ui.SwingTestHarness.onEdt;
import static ai.attackframework.tools.textedit.ui.SwingTestHarness.onEdtCall;
import static org.assertj.core.api.Assertions.assertThat;

class FindReplaceBarHeadlessTest {

    private Preferences prefs;
    private RegionTextArea area;
    private FindReplaceBar bar;

    @BeforeEach
    void setUp() {
        prefs = Preferences.userRoot().node("ai.attackframework.tools.textedit.test/" + UUID.randomUUID());
        area = onEdtCall(() -> {
            RegionTextArea a = new RegionTextArea();
            a.setText("foo bar foo");
            return a;
        });
        bar = onEdtCall(() -> new FindReplaceBar(area, EditorSettings.defaults(), prefs));
    }

    @AfterEach
    void tearDown() throws BackingStoreException {
        prefs.removeNode();
    }

    private void type(String fieldName, String text) {
        JTextField f = named(bar, fieldName, JTextField.class);
        onEdt(() -> f.setText(text));
    }

    @Test
    void next_button_selects_first_match() {
        type("find.field", "foo");
        click(named(bar, "find.next", JButton.class));

        assertThat(onEdtCall(area::getSelectionStart)).isZero();
        assertThat(onEdtCall(area::getSelectionEnd)).isEqualTo(3);
        assertThat(onEdtCall(bar::statusText)).isEmpty();
    }

    @Test
    void enter_and_shift_enter_step_through_matches() {
        type("find.field", "foo");
        JTextField field = named(bar, "find.field", JTextField.class);

        fireAction(field, "find.next");
        fireAction(field, "find.next");
        assertThat(onEdtCall(area::getSelectionStart)).isEqualTo(8);

        fireAction(field, "find.prev");
        assertThat(onEdtCall(area::getSelectionStart)).isZero();
    }

    @Test
    void replace_selects_then_substitutes() {
        type("find.field", "foo");
        type("find.replace", "baz");
        JButton replace = named(bar, "find.replaceOne", JButton.class);

        click(replace);
        assertThat(onEdtCall(() -> area.getText())).isEqualTo("foo bar foo");
        click(replace);
        assertThat(onEdtCall(() -> area.getText())).isEqualTo("baz bar foo");
    }

    @Test
    void replace_all_reports_count() {
        type("find.field", "foo");
        type("find.replace", "baz");

        click(named(bar, "find.replaceAll", JButton.class));

        assertThat(onEdtCall(() -> area.getText())).isEqualTo("baz bar baz");
        assertThat(onEdtCall(bar::statusText)).isEqualTo("Replaced 2 occurrences");
    }

    @Test
    void replace_all_without_hits_reports_it() {
        type("find.field", "zzz");
        assertThat(onEdtCall(bar::replaceAll)).isZero();
        assertThat(onEdtCall(bar::statusText)).isEqualTo("No occurrences of zzz");
    }

    @Test
    void miss_reports_not_found() {
        type("find.field", "zzz");
        assertThat(onEdtCall(() -> bar.step(false, false))).isFalse();
        assertThat(onEdtCall(bar::statusText)).isEqualTo("Not found: zzz");
    }

    @Test
    void invalid_pattern_reported_in_status_and_indicator() {
        type("find.field", "(");
        assertThat(onEdtCall(() -> bar.step(false, false))).isFalse();

        assertThat(onEdtCall(bar::statusText)).startsWith("Invalid pattern");
        JLabel indicator = named(bar, "find.regex.indicator", JLabel.class);
        assertThat(onEdtCall(() -> indicator.getText())).isEqualTo("✖");
        assertThat(onEdtCall(indicator::isVisible)).isTrue();
    }

    @Test
    void invalid_pattern_is_logged_as_warning() {
        List<String> seen = new CopyOnWriteArrayList<>();
        Logger.LogListener listener = (level, message) -> seen.add(level + ":" + message);
        Logger.registerListener(listener);
        try {
            type("find.field", "(");
            onEdtCall(() -> bar.step(false, false));
        } finally {
            Logger.unregisterListener(listener);
        }
        assertThat(seen).anySatisfy(m -> assertThat(m).startsWith("WARN:Invalid find pattern '('"));
    }

    @Test
    void settings_supply_case_default_until_preference_is_stored() {
        EditorSettings matchCase = new EditorSettings(false, true, true, EditorSettings.DEFAULT_TINT_FACTOR);

        FindReplaceBar fromSettings = onEdtCall(() -> new FindReplaceBar(area, matchCase, prefs));
        assertThat(onEdtCall(() -> named(fromSettings, "find.case", JCheckBox.class).isSelected())).isTrue();

        prefs.putBoolean(FindReplaceBar.PREF_MATCH_CASE, false);
        FindReplaceBar fromPrefs = onEdtCall(() -> new FindReplaceBar(area, matchCase, prefs));
        assertThat(onEdtCall(() -> named(fromPrefs, "find.case", JCheckBox.class).isSelected())).isFalse();
    }

    @Test
    void case_toggle_controls_matching() {
        onEdt(() -> area.setText("Foo"));
        type("find.field", "foo");
        JCheckBox caseToggle = named(bar, "find.case", JCheckBox.class);

        assertThat(onEdtCall(() -> bar.step(false, false))).isTrue();
        click(caseToggle);
        onEdt(() -> area.setCaretPosition(0));
        assertThat(onEdtCall(() -> bar.step(false, false))).isFalse();
        assertThat(prefs.getBoolean(FindReplaceBar.PREF_MATCH_CASE, false)).isTrue();
    }

    @Test
    void whitespace_toggle_drives_area_and_preference() {
        JCheckBox toggle = named(bar, "find.whitespace", JCheckBox.class);
        assertThat(onEdtCall(area::isDrawWhitespace)).isFalse();

        click(toggle);

        assertThat(onEdtCall(area::isDrawWhitespace)).isTrue();
        assertThat(prefs.getBoolean(FindReplaceBar.PREF_WHITESPACE, false)).isTrue();
    }

    @Test
    void texts_persist_and_restore() {
        type("find.field", "needle");
        type("find.replace", "thread");
        assertThat(prefs.get(FindReplaceBar.PREF_LAST_SEARCH, "")).isEqualTo("needle");

        FindReplaceBar restored = onEdtCall(() -> new FindReplaceBar(area, EditorSettings.defaults(), prefs));
        assertThat(onEdtCall(() -> named(restored, "find.field", JTextField.class).getText())).isEqualTo("needle");
        assertThat(onEdtCall(() -> named(restored, "find.replace", JTextField.class).getText())).isEqualTo("thread");
    }
}
