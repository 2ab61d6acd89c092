package io.specbridge.core.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 *
 */
@UtilityClass
public class JsonUtils {

    public static JsonMapper createMapper() {
        final var mapper = new JsonMapper();
        mapper.findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS);
        return mapper;
    }

    /**
     * Detached copy of a node, <code>null</code> stays <code>null</code>
     */
    public static <T extends JsonNode> T copy(final T node) {
        return null == node ? null : node.deepCopy();
    }

    /**
     * Text value of a field, if present and textual
     */
    public static Optional<String> text(final JsonNode node, final String field) {
        if (null == node) {
            return Optional.empty();
        }
        final var value = node.get(field);
        return null != value && value.isTextual()
               ? Optional.of(value.asText())
               : Optional.empty();
    }

    /**
     * Text value of a field, or the given default
     */
    public static String text(final JsonNode node, final String field, final String defaultValue) {
        return text(node, field).orElse(defaultValue);
    }

    /**
     * Object-valued field, or <code>null</code>
     */
    public static JsonNode object(final JsonNode node, final String field) {
        if (null == node) {
            return null;
        }
        final var value = node.get(field);
        return null != value && value.isObject() ? value : null;
    }
}
