package io.specbridge.openapi;

import com.fasterxml.jackson.databind.JsonNode;
import io.specbridge.core.tools.HttpMethod;
import io.specbridge.core.tools.ParameterLocation;
import io.specbridge.core.tools.ParameterSpec;
import io.specbridge.core.tools.RequestBodySpec;
import io.specbridge.core.tools.ToolDefinition;
import io.specbridge.core.utils.JsonUtils;
import io.specbridge.openapi.config.ToolGenerationConfig;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.StreamSupport;

/**
 * Compiles every retained path + method pair of an API description into a {@link ToolDefinition}.
 * <p>
 * Compilation is a single synchronous pass. The same document always yields the same list of definitions.
 */
@Slf4j
public class ToolCompiler {
    private static final List<String> SUCCESS_CODES = List.of("200", "201", "204");
    private static final String JSON_MEDIA_TYPE = "application/json";
    private static final String BODY_LOCATION = "body";
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]+");

    private final boolean snakeCaseNames;
    private final boolean simplifiedNames;
    private final String toolPrefix;
    private final boolean strictReferences;

    @Builder
    public ToolCompiler(boolean snakeCaseNames, boolean simplifiedNames, String toolPrefix, boolean strictReferences) {
        this.snakeCaseNames = snakeCaseNames;
        this.simplifiedNames = simplifiedNames;
        this.toolPrefix = Objects.requireNonNullElse(toolPrefix, "");
        this.strictReferences = strictReferences;
    }

    public static ToolCompiler from(@NonNull ToolGenerationConfig config) {
        return new ToolCompiler(config.isSnakeCaseNames(),
                                config.isSimplifiedNames(),
                                config.getToolPrefix(),
                                config.isStrictReferences());
    }

    /**
     * Compiles the document
     *
     * @param document        Loaded API description
     * @param inclusionPolicy Which operations to keep
     * @return Tool definitions in document order, with unique names
     */
    public List<ToolDefinition> compile(@NonNull ApiDocument document, @NonNull InclusionPolicy inclusionPolicy) {
        final var resolver = new SchemaResolver(document, strictReferences);
        final var tools = new ArrayList<ToolDefinition>();
        final var usedNames = new HashSet<String>();
        document.paths().fields().forEachRemaining(pathEntry -> {
            final var path = pathEntry.getKey();
            final var pathItem = resolver.resolveSchema(pathEntry.getValue());
            for (final var method : HttpMethod.values()) {
                final var operation = JsonUtils.object(pathItem, method.lowerCase());
                if (null == operation) {
                    continue;
                }
                final var operationId = JsonUtils.text(operation, "operationId")
                        .filter(StringUtils::isNotBlank)
                        .orElse(null);
                if (!inclusionPolicy.includes(operationId, path)) {
                    log.debug("Skipping {} {} ({})", method, path, operationId);
                    continue;
                }
                final var tool = compileOperation(resolver, path, pathItem, method, operationId, operation);
                tools.add(tool.withName(uniqueName(tool.getName(), usedNames)));
            }
        });
        log.debug("Compiled {} tools", tools.size());
        return List.copyOf(tools);
    }

    /**
     * Name derivation: declared operation id or <code>method_path</code>, then snake casing, simplification and
     * prefixing as configured.
     */
    public String toolName(HttpMethod method, String path, String operationId) {
        var name = null != operationId ? operationId : rawName(method, path);
        if (snakeCaseNames) {
            name = NameSimplifier.toSnakeCase(name);
        }
        if (simplifiedNames) {
            name = NameSimplifier.simplify(name);
        }
        return toolPrefix + name;
    }

    static String rawName(HttpMethod method, String path) {
        final var folded = StringUtils.strip(NON_ALPHANUMERIC.matcher(path).replaceAll(NameSimplifier.DELIMITER),
                                             NameSimplifier.DELIMITER);
        return StringUtils.strip(method.lowerCase() + NameSimplifier.DELIMITER + folded, NameSimplifier.DELIMITER);
    }

    private ToolDefinition compileOperation(
            SchemaResolver resolver,
            String path,
            JsonNode pathItem,
            HttpMethod method,
            String operationId,
            JsonNode operation) {
        final var summary = JsonUtils.text(operation, "summary", "");
        final var longDescription = JsonUtils.text(operation, "description", "");
        final var description = StringUtils.isBlank(longDescription)
                                ? summary
                                : (summary + "\n\n" + longDescription).strip();
        return ToolDefinition.builder()
                .name(toolName(method, path, operationId))
                .operationId(operationId)
                .httpMethod(method)
                .pathTemplate(path)
                .parameters(parameters(resolver, path, pathItem, operation))
                .requestBody(requestBody(resolver, pathItem, operation))
                .responseSchema(responseSchema(resolver, operation))
                .tags(tags(operation))
                .description(description)
                .build();
    }

    private List<ParameterSpec> parameters(
            SchemaResolver resolver,
            String path,
            JsonNode pathItem,
            JsonNode operation) {
        final var declared = new LinkedHashMap<String, ParameterSpec>();
        parameterNodes(pathItem).forEach(node -> parameter(resolver, node)
                .ifPresent(parameter -> declared.put(key(parameter), parameter)));
        parameterNodes(operation).forEach(node -> parameter(resolver, node)
                .ifPresent(parameter -> declared.put(key(parameter), parameter)));
        final var parameters = new ArrayList<>(declared.values());
        final var declaredPathParameters = parameters.stream()
                .filter(parameter -> parameter.getLocation() == ParameterLocation.PATH)
                .map(ParameterSpec::getName)
                .toList();
        ToolDefinition.placeholders(path)
                .stream()
                .filter(placeholder -> !declaredPathParameters.contains(placeholder))
                .forEach(placeholder -> {
                    log.debug("Path {} has undeclared placeholder {{{}}}. Adding it as a string parameter",
                              path, placeholder);
                    parameters.add(ParameterSpec.builder()
                                           .name(placeholder)
                                           .location(ParameterLocation.PATH)
                                           .required(true)
                                           .build());
                });
        return parameters;
    }

    private static List<JsonNode> parameterNodes(JsonNode owner) {
        final var parameters = null == owner ? null : owner.get("parameters");
        if (null == parameters || !parameters.isArray()) {
            return List.of();
        }
        return StreamSupport.stream(parameters.spliterator(), false).toList();
    }

    private Optional<ParameterSpec> parameter(SchemaResolver resolver, JsonNode declaration) {
        final var node = resolver.resolveSchema(declaration);
        final var name = JsonUtils.text(node, "name").orElse(null);
        final var locationName = JsonUtils.text(node, "in").orElse(null);
        if (BODY_LOCATION.equals(locationName)) {
            return Optional.empty();
        }
        final var location = ParameterLocation.fromValue(locationName).orElse(null);
        if (null == name || null == location) {
            log.warn("Ignoring parameter without a name or with unsupported location. name: {}, in: {}",
                     name, locationName);
            return Optional.empty();
        }
        // Swagger 2 declares type information on the parameter itself
        final var schema = Objects.requireNonNullElse(JsonUtils.object(node, "schema"), node);
        return Optional.of(ParameterSpec.builder()
                                   .name(name)
                                   .location(location)
                                   .required(location == ParameterLocation.PATH
                                                     || node.path("required").asBoolean(false))
                                   .description(JsonUtils.text(node, "description", ""))
                                   .typeHint(JsonUtils.text(schema, "type", "string"))
                                   .defaultValue(copy(schema.get("default")))
                                   .enumValues(copy(schema.get("enum")))
                                   .schema(node == schema ? null : schema.deepCopy())
                                   .build());
    }

    private RequestBodySpec requestBody(SchemaResolver resolver, JsonNode pathItem, JsonNode operation) {
        final var body = Optional.ofNullable(resolver.resolveSchema(JsonUtils.object(operation, "requestBody")))
                .or(() -> bodyParameter(resolver, pathItem, operation))
                .orElse(null);
        if (null == body) {
            return null;
        }
        final var builder = RequestBodySpec.builder()
                .required(body.path("required").asBoolean(false))
                .description(JsonUtils.text(body, "description", ""));
        final var schema = resolver.resolveSchema(jsonSchema(body));
        if (null == schema) {
            return builder.build();
        }
        final var required = new HashSet<String>();
        schema.path("required").forEach(name -> required.add(name.asText()));
        final var properties = JsonUtils.object(schema, "properties");
        if (null != properties) {
            properties.fields().forEachRemaining(property -> builder.property(
                    bodyProperty(resolver, property.getKey(), property.getValue(), required)));
        }
        return builder.schema(schema.deepCopy()).build();
    }

    /**
     * Swagger 2 <code>in: body</code> parameter. The operation's declaration wins over the path item's.
     */
    private static Optional<JsonNode> bodyParameter(SchemaResolver resolver, JsonNode pathItem, JsonNode operation) {
        JsonNode found = null;
        for (final var owner : List.of(pathItem, operation)) {
            for (final var declaration : parameterNodes(owner)) {
                final var node = resolver.resolveSchema(declaration);
                if (BODY_LOCATION.equals(JsonUtils.text(node, "in").orElse(null))) {
                    found = node;
                }
            }
        }
        return Optional.ofNullable(found);
    }

    private static ParameterSpec bodyProperty(
            SchemaResolver resolver,
            String name,
            JsonNode declaration,
            Set<String> required) {
        final var schema = resolver.resolveSchema(declaration);
        final var description = JsonUtils.text(declaration, "description")
                .or(() -> JsonUtils.text(schema, "description"))
                .orElse("");
        return ParameterSpec.builder()
                .name(name)
                .required(required.contains(name))
                .description(description)
                .typeHint(JsonUtils.text(schema, "type", "string"))
                .defaultValue(copy(schema.get("default")))
                .enumValues(copy(schema.get("enum")))
                .schema(schema.deepCopy())
                .build();
    }

    private static JsonNode responseSchema(SchemaResolver resolver, JsonNode operation) {
        final var responses = JsonUtils.object(operation, "responses");
        if (null == responses) {
            return null;
        }
        for (final var code : SUCCESS_CODES) {
            final var response = resolver.resolveSchema(JsonUtils.object(responses, code));
            final var schema = resolver.resolveSchema(jsonSchema(response));
            if (null != schema) {
                return schema.deepCopy();
            }
        }
        return null;
    }

    /**
     * Schema of the JSON media type of a request body or response. <code>application/json</code> is preferred over
     * other JSON flavoured types like <code>application/problem+json</code>. Swagger 2 body parameters and responses
     * carry the schema directly.
     */
    private static JsonNode jsonSchema(JsonNode owner) {
        final var content = JsonUtils.object(owner, "content");
        if (null == content) {
            return JsonUtils.object(owner, "schema");
        }
        var media = JsonUtils.object(content, JSON_MEDIA_TYPE);
        if (null == media) {
            final var fields = content.fields();
            while (null == media && fields.hasNext()) {
                final var entry = fields.next();
                if (entry.getKey().toLowerCase().contains("json") && entry.getValue().isObject()) {
                    media = entry.getValue();
                }
            }
        }
        return JsonUtils.object(media, "schema");
    }

    private static List<String> tags(JsonNode operation) {
        final var tags = new ArrayList<String>();
        operation.path("tags").forEach(tag -> {
            if (tag.isTextual()) {
                tags.add(tag.asText());
            }
        });
        return tags;
    }

    private static String uniqueName(String name, Set<String> usedNames) {
        if (usedNames.add(name)) {
            return name;
        }
        var counter = 2;
        while (!usedNames.add(name + NameSimplifier.DELIMITER + counter)) {
            counter++;
        }
        final var unique = name + NameSimplifier.DELIMITER + counter;
        log.warn("Tool name {} is already taken. Using {} instead", name, unique);
        return unique;
    }

    private static String key(ParameterSpec parameter) {
        return parameter.getLocation().getValue() + ":" + parameter.getName();
    }

    private static JsonNode copy(JsonNode node) {
        return null == node ? null : node.deepCopy();
    }

    /**
     * Indexes tools by name, keeping catalog order
     */
    public static Map<String, ToolDefinition> index(List<ToolDefinition> tools) {
        final var index = new LinkedHashMap<String, ToolDefinition>();
        tools.forEach(tool -> index.put(tool.getName(), tool));
        return index;
    }
}
