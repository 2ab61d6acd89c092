package io.specbridge.openapi.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Controls which operations become tools and how they are named
 */
@Value
@Builder
@Jacksonized
public class ToolGenerationConfig {
    @JsonProperty("include_all")
    @Builder.Default
    boolean includeAll = true;

    /**
     * Operation identifiers or raw paths to include when {@link #includeAll} is off
     */
    @JsonProperty("include_endpoints")
    List<String> includeEndpoints;

    /**
     * Operation identifiers or raw paths that are never compiled
     */
    @JsonProperty("exclude_endpoints")
    List<String> excludeEndpoints;

    @JsonProperty("snake_case_names")
    @Builder.Default
    boolean snakeCaseNames = true;

    @JsonProperty("simplified_names")
    @Builder.Default
    boolean simplifiedNames = true;

    @JsonProperty("tool_prefix")
    @Builder.Default
    String toolPrefix = "";

    /**
     * Fail compilation on a <code>$ref</code> that cannot be resolved instead of using an empty schema
     */
    @JsonProperty("strict_references")
    boolean strictReferences;

    public static ToolGenerationConfig defaults() {
        return ToolGenerationConfig.builder().build();
    }
}
