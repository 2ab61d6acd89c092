package io.specbridge.openapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.specbridge.core.utils.JsonUtils;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * A loaded API description (OpenAPI 3 or Swagger 2) as a JSON tree. The tree is never modified after loading.
 */
@Value
public class ApiDocument {
    @NonNull
    JsonNode root;

    /**
     * URL the document was fetched from, <code>null</code> when it was read from a file
     */
    String sourceUrl;

    public static ApiDocument of(JsonNode root) {
        return new ApiDocument(root, null);
    }

    public JsonNode paths() {
        return Optional.ofNullable(JsonUtils.object(root, "paths"))
                .orElseGet(JsonNodeFactory.instance::objectNode);
    }

    public ApiInfo info() {
        final var info = JsonUtils.object(root, "info");
        final var builder = ApiInfo.builder();
        JsonUtils.text(info, "title").ifPresent(builder::title);
        JsonUtils.text(info, "description").ifPresent(builder::description);
        JsonUtils.text(info, "version").ifPresent(builder::version);
        return builder.build();
    }

    /**
     * The <code>url</code> of the first entry of <code>servers</code>, if any
     */
    public Optional<String> firstServerUrl() {
        final var servers = root.get("servers");
        if (null == servers || !servers.isArray() || servers.isEmpty()) {
            return Optional.empty();
        }
        return JsonUtils.text(servers.get(0), "url");
    }

    /**
     * Component schemas (<code>components.schemas</code>), empty if the document declares none
     */
    public JsonNode schemas() {
        return Optional.ofNullable(JsonUtils.object(JsonUtils.object(root, "components"), "schemas"))
                .orElseGet(JsonNodeFactory.instance::objectNode);
    }
}
