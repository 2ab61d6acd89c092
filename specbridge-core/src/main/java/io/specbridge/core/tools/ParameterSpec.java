package io.specbridge.core.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.specbridge.core.utils.JsonUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * A single argument of a tool. Used both for operation parameters and for the flattened first-level properties of a
 * request body (those have a <code>null</code> location).
 */
@Value
@Builder
@With
public class ParameterSpec {
    /**
     * Name of the parameter as declared in the document. This is also the argument key callers use.
     */
    @NonNull
    String name;

    /**
     * Position in the request. <code>null</code> for request body properties.
     */
    ParameterLocation location;

    boolean required;

    @Builder.Default
    String description = "";

    /**
     * JSON schema type of the value (string, integer, number, boolean, array, object). Defaults to string.
     */
    @Builder.Default
    String typeHint = "string";

    JsonNode defaultValue;

    JsonNode enumValues;

    /**
     * Raw schema as declared, unresolved for operation parameters
     */
    JsonNode schema;

    public JsonNode getDefaultValue() {
        return JsonUtils.copy(defaultValue);
    }

    public JsonNode getEnumValues() {
        return JsonUtils.copy(enumValues);
    }

    public JsonNode getSchema() {
        return JsonUtils.copy(schema);
    }
}
