package io.specbridge.core.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.specbridge.core.utils.JsonUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A named, invocable operation compiled from one path + method pair of an API description.
 * Every <code>{name}</code> placeholder in {@link #pathTemplate} has exactly one {@link ParameterLocation#PATH}
 * parameter.
 */
@Value
@With
@Builder
public class ToolDefinition {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}/]+)}");

    /**
     * Unique name of the tool within its catalog
     */
    @NonNull
    String name;

    /**
     * Declared operation identifier, if the document had one
     */
    String operationId;

    @NonNull
    HttpMethod httpMethod;

    @NonNull
    String pathTemplate;

    @Singular
    List<ParameterSpec> parameters;

    RequestBodySpec requestBody;

    JsonNode responseSchema;

    @Singular
    List<String> tags;

    @NonNull
    @Builder.Default
    String description = "";

    public List<ParameterSpec> parametersIn(ParameterLocation location) {
        return parameters.stream()
                .filter(parameter -> parameter.getLocation() == location)
                .toList();
    }

    public List<ParameterSpec> bodyProperties() {
        return null == requestBody ? List.of() : requestBody.getProperties();
    }

    /**
     * Names of all <code>{name}</code> placeholders of a path template, in order of appearance
     */
    public static Set<String> placeholders(String pathTemplate) {
        final var names = new LinkedHashSet<String>();
        final var matcher = PLACEHOLDER.matcher(pathTemplate);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    public static String substitute(String pathTemplate, String name, String value) {
        return pathTemplate.replace("{" + name + "}", value);
    }

    public JsonNode getResponseSchema() {
        return JsonUtils.copy(responseSchema);
    }
}
