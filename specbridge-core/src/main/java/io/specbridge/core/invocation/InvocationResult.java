package io.specbridge.core.invocation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.specbridge.core.errors.ErrorType;
import io.specbridge.core.errors.ToolInvocationError;
import io.specbridge.core.tools.HttpMethod;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of a single tool invocation. Failed and successful invocations have the same envelope shape
 * (<code>{success, data|error, statusCode?, detail?}</code>), so consumers can branch on {@link #isSuccess()} alone.
 * <p>
 * When the backend answered with a JSON document, that document is passed through unchanged by {@link #toJson}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvocationResult {
    boolean success;
    @NonNull
    ErrorType errorType;
    JsonNode data;
    String error;
    Integer statusCode;
    JsonNode detail;
    /**
     * The data is the backend's own JSON response
     */
    boolean passthrough;

    public static InvocationResult passthrough(@NonNull JsonNode body, int statusCode) {
        return new InvocationResult(true, ErrorType.SUCCESS, body, null, statusCode, null, true);
    }

    public static InvocationResult text(String body, int statusCode) {
        return new InvocationResult(true, ErrorType.SUCCESS, TextNode.valueOf(body), null, statusCode, null, false);
    }

    public static InvocationResult unreachable(String host) {
        return failure(ErrorType.CONNECTION_FAILURE, ErrorType.CONNECTION_FAILURE.format(host), null, null);
    }

    public static InvocationResult httpFailure(HttpMethod method, String path, int statusCode, JsonNode detail) {
        return failure(ErrorType.HTTP_STATUS_FAILURE,
                       ErrorType.HTTP_STATUS_FAILURE.format(method.name(), path, statusCode),
                       statusCode,
                       detail);
    }

    public static InvocationResult unexpected(String message) {
        return failure(ErrorType.UNEXPECTED_FAILURE, ErrorType.UNEXPECTED_FAILURE.format(message), null, null);
    }

    public static InvocationResult rejected(ToolInvocationError error) {
        return failure(error.getErrorType(), error.getMessage(), null, null);
    }

    private static InvocationResult failure(ErrorType type, String message, Integer statusCode, JsonNode detail) {
        return new InvocationResult(false, type, null, message, statusCode, detail, false);
    }

    /**
     * Renders the result as the JSON value handed to consumers
     *
     * @param mapper Mapper used to create the envelope
     * @return The backend JSON for pass-through results, the envelope otherwise
     */
    public JsonNode toJson(ObjectMapper mapper) {
        if (passthrough) {
            return data;
        }
        final var envelope = mapper.createObjectNode().put("success", success);
        if (success) {
            envelope.set("data", data);
            return envelope;
        }
        envelope.put("error", error);
        if (null != statusCode) {
            envelope.put("statusCode", statusCode);
        }
        if (null != detail) {
            envelope.set("detail", detail);
        }
        return envelope;
    }
}
