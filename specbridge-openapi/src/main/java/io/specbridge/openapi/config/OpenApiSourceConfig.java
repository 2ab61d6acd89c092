package io.specbridge.openapi.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Where the API description comes from and how the described API is reached
 */
@Value
@Builder
@Jacksonized
public class OpenApiSourceConfig {
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    /**
     * Base URL of the API. If not set, the first <code>servers</code> entry of the document is used.
     */
    @JsonProperty("base_url")
    String baseUrl;

    /**
     * URL of the document itself or of an HTML documentation page (Swagger UI, ReDoc) that references it
     */
    @JsonProperty("openapi_url")
    String openapiUrl;

    /**
     * Local JSON or YAML file. Takes precedence over {@link #openapiUrl}.
     */
    @JsonProperty("openapi_file")
    String openapiFile;

    /**
     * Timeout in seconds for fetching the document and for every tool call
     */
    Integer timeout;

    /**
     * Opaque headers sent with every request, for example an <code>Authorization</code> header
     */
    @Singular
    Map<String, String> headers;

    public Duration timeoutDuration() {
        return Duration.ofSeconds(Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT_SECONDS));
    }
}
