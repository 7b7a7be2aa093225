package benor.util;

/**
 * Central flag to enable/disable debug printing throughout the project.
 * Turned on with {@code -Dbenor.debug=true}.
 */
public final class DebugConfig {
    private DebugConfig() {}

    public static final boolean ENABLED = Boolean.getBoolean("benor.debug");
}
