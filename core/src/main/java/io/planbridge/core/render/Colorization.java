// file: core/src/main/java/io/planbridge/core/render/Colorization.java
package io.planbridge.core.render;

/** Whether preview text carries ANSI color codes. */
public enum Colorization {
    NEVER,
    ALWAYS;

    static final String RESET = "\u001B[0m";
    static final String GREEN = "\u001B[32m";
    static final String RED = "\u001B[31m";
    static final String YELLOW = "\u001B[33m";
    static final String MAGENTA = "\u001B[35m";

    String paint(String color, String text) {
        return this == ALWAYS ? color + text + RESET : text;
    }

    /** Case-insensitive parse, used by config flags. */
    public static Colorization parse(String s) {
        return switch (s.trim().toLowerCase()) {
            case "never", "off", "false" -> NEVER;
            case "always", "on", "true" -> ALWAYS;
            default -> throw new IllegalArgumentException("unknown colorization: " + s);
        };
    }
}
