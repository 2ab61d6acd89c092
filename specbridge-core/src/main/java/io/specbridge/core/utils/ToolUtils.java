package io.specbridge.core.utils;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Small helpers shared by the compiler and the dispatcher
 */
@UtilityClass
public class ToolUtils {
    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Message of the innermost cause, or its class name if it carries none
     */
    public static String rootCauseMessage(final Throwable leaf) {
        final var cause = rootCause(leaf);
        return Objects.requireNonNullElse(cause.getMessage(), cause.getClass().getSimpleName());
    }

    /**
     * First line of a (possibly multi-line) text, empty if null
     */
    public static String firstLine(final String text) {
        if (null == text || text.isEmpty()) {
            return "";
        }
        final var newline = text.indexOf('\n');
        return (newline < 0 ? text : text.substring(0, newline)).trim();
    }
}
