package io.specbridge.core.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.specbridge.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * JSON request body of an operation. Only first-level properties are flattened, nested objects are passed as-is.
 */
@Value
@Builder
public class RequestBodySpec {
    boolean required;

    @Builder.Default
    String description = "";

    /**
     * The resolved body schema
     */
    JsonNode schema;

    @Singular
    List<ParameterSpec> properties;

    public Optional<ParameterSpec> property(String name) {
        return properties.stream()
                .filter(property -> property.getName().equals(name))
                .findFirst();
    }

    public JsonNode getSchema() {
        return JsonUtils.copy(schema);
    }
}
