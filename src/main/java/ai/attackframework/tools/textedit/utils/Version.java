package ai.attackframework.tools.textedit.utils;

/**
 * Centralized version accessor.
 * Production: reads Implementation-Version from the JAR manifest.
 * Tests and IDE runs: {@code -Dtextedit.version=<value>} overrides; otherwise {@code "dev"}.
 */
public final class Version {

    static final String PROPERTY = "textedit.version";
    static final String UNPACKAGED = "dev";

    private Version() {}

    public static String get() {
        String override = System.getProperty(PROPERTY);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        Package p = Version.class.getPackage();
        String mv = (p != null) ? p.getImplementationVersion() : null;
        return (mv == null || mv.isBlank()) ? UNPACKAGED : mv;
    }
}
