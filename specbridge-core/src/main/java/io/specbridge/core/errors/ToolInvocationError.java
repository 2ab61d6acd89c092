package io.specbridge.core.errors;

import lombok.Getter;

/**
 * Raised when a tool call is rejected before anything is sent to the backend
 */
@Getter
public abstract class ToolInvocationError extends RuntimeException {
    private final String toolName;
    private final ErrorType errorType;

    protected ToolInvocationError(String toolName, ErrorType errorType, String message) {
        super(message);
        this.toolName = toolName;
        this.errorType = errorType;
    }
}
