// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core;

/**
 * ANSI color palette for terminal output with automatic TTY detection.
 *
 * <p>Colors are disabled when not running in a TTY unless {@code FORCE_COLOR=true}
 * is set, so every constant is safe to concatenate into log lines.
 *
 * <ul>
 * <li><b>TEAL</b> - success</li>
 * <li><b>CORAL</b> - errors</li>
 * <li><b>INDIGO</b> - RPC traffic</li>
 * <li><b>AMBER</b> - HTTP requests served</li>
 * <li><b>SLATE</b> - metadata such as durations</li>
 * </ul>
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    /** Whether stdout is attached to a terminal (or colors are forced). */
    public static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    public static final String RESET = ansi("0");
    public static final String TEAL = ansi("38;5;44");
    public static final String CORAL = ansi("38;5;204");
    public static final String INDIGO = ansi("38;5;99");
    public static final String AMBER = ansi("38;5;214");
    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
