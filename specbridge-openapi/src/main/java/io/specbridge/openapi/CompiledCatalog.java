package io.specbridge.openapi;

import com.fasterxml.jackson.databind.JsonNode;
import io.specbridge.core.tools.CatalogSummarizer;
import io.specbridge.core.tools.ToolDefinition;
import io.specbridge.core.utils.JsonUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Result of compiling one API description. Read-only once built.
 */
@Value
@Builder
public class CompiledCatalog {
    @NonNull
    ApiInfo apiInfo;

    /**
     * Effective base URL tools are dispatched against. May be empty if neither configuration nor document has one.
     */
    @NonNull
    @Builder.Default
    String baseUrl = "";

    @Singular
    List<ToolDefinition> tools;

    /**
     * Component schemas of the document
     */
    JsonNode schemas;

    public Optional<ToolDefinition> tool(String name) {
        return tools.stream()
                .filter(tool -> tool.getName().equals(name))
                .findFirst();
    }

    public JsonNode getSchemas() {
        return JsonUtils.copy(schemas);
    }

    public String summary() {
        return CatalogSummarizer.summarize(tools);
    }
}
