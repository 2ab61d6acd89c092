package io.specbridge.openapi.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;

/**
 * One configured API server. Only servers of type {@value #OPENAPI_TYPE} are compiled into tool catalogs.
 */
@Value
@Builder
@Jacksonized
public class ApiServerConfig {
    public static final String OPENAPI_TYPE = "openapi";

    String name;

    @Builder.Default
    String type = OPENAPI_TYPE;

    @Builder.Default
    boolean enabled = true;

    String description;

    OpenApiSourceConfig openapi;

    @JsonProperty("tool_generation")
    @JsonAlias("toolGeneration")
    @With
    ToolGenerationConfig toolGeneration;

    public boolean isOpenApi() {
        return OPENAPI_TYPE.equalsIgnoreCase(type);
    }

    public ToolGenerationConfig effectiveToolGeneration() {
        return Objects.requireNonNullElseGet(toolGeneration, ToolGenerationConfig::defaults);
    }
}
