package io.specbridge.core.errors;

import lombok.Getter;

/**
 * A required path, query or body argument was not supplied (or was null)
 */
@Getter
public class MissingRequiredParameterError extends ToolInvocationError {
    private final String parameterName;

    public MissingRequiredParameterError(final String toolName, final String parameterName) {
        super(toolName, ErrorType.MISSING_PARAMETER, ErrorType.MISSING_PARAMETER.format(parameterName, toolName));
        this.parameterName = parameterName;
    }
}
