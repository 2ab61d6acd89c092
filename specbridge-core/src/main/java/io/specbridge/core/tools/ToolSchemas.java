package io.specbridge.core.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Renders the argument shape of a tool as a JSON schema object
 */
@UtilityClass
public class ToolSchemas {

    /**
     * Arguments a caller can pass to the tool: forwarded parameters followed by request body properties.
     * Header and cookie parameters are left out as they are never sent.
     */
    public static List<ParameterSpec> arguments(ToolDefinition tool) {
        return Stream.concat(tool.getParameters()
                                     .stream()
                                     .filter(parameter -> parameter.getLocation().isForwarded()),
                             tool.bodyProperties().stream())
                .toList();
    }

    public static ObjectNode inputSchema(ToolDefinition tool, ObjectMapper mapper) {
        final var properties = mapper.createObjectNode();
        final var required = new ArrayList<String>();
        arguments(tool).forEach(argument -> {
            if (properties.has(argument.getName())) {
                return;
            }
            final var property = properties.putObject(argument.getName())
                    .put("type", argument.getTypeHint());
            if (!argument.getDescription().isEmpty()) {
                property.put("description", argument.getDescription());
            }
            copyIfPresent(argument.getEnumValues(), "enum", property);
            copyIfPresent(argument.getDefaultValue(), "default", property);
            final var declared = argument.getSchema();
            if ("array".equals(argument.getTypeHint()) && null != declared && declared.has("items")) {
                property.set("items", declared.get("items"));
            }
            if (argument.isRequired()) {
                required.add(argument.getName());
            }
        });
        final var schema = mapper.createObjectNode()
                .put("type", "object");
        schema.set("properties", properties);
        schema.set("required", mapper.valueToTree(required));
        return schema;
    }

    private static void copyIfPresent(JsonNode value, String field, ObjectNode target) {
        if (null != value && !value.isNull()) {
            target.set(field, value);
        }
    }
}
