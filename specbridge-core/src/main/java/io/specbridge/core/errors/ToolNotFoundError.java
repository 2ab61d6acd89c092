package io.specbridge.core.errors;

/**
 * No tool with the given name exists in the catalog
 */
public class ToolNotFoundError extends ToolInvocationError {
    public ToolNotFoundError(final String toolName) {
        super(toolName, ErrorType.TOOL_NOT_FOUND, ErrorType.TOOL_NOT_FOUND.format(toolName));
    }
}
