package io.specbridge.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Classification of a tool invocation outcome
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", false),
    TOOL_NOT_FOUND("Unknown tool: %s", false),
    MISSING_PARAMETER("Missing required parameter %s for tool %s", false),
    CONNECTION_FAILURE("%s unreachable", true),
    HTTP_STATUS_FAILURE("%s %s failed (HTTP %d)", false),
    UNEXPECTED_FAILURE("%s", true),
    ;

    private final String message;
    private final boolean retryable;

    public String format(Object... args) {
        return message.formatted(args);
    }
}
