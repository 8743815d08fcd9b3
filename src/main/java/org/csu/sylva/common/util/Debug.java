package org.csu.sylva.common.util;

/**
 * 控制台日志。调试输出只有在 {@code -Dsylva.debug=true} 时才会打印。
 */
public final class Debug {

    public static final String DEBUG_PROPERTY = "sylva.debug";

    private static volatile boolean enabled = Boolean.getBoolean(DEBUG_PROPERTY);

    private Debug() {
    }

    public static boolean isEnabled() {
        return enabled;
    }

    public static void setEnabled(boolean value) {
        enabled = value;
    }

    public static void log(String message) {
        System.out.println(message);
    }

    public static void logDebug(String message) {
        if (enabled) {
            System.out.println("[DEBUG] " + message);
        }
    }

    public static void logError(String message) {
        System.err.println("[ERROR] " + message);
    }
}
