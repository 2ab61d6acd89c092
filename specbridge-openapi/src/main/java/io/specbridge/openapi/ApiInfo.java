package io.specbridge.openapi;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The <code>info</code> block of an API description
 */
@Value
@Builder
public class ApiInfo {
    @NonNull
    @Builder.Default
    String title = "API";

    @NonNull
    @Builder.Default
    String description = "";

    @NonNull
    @Builder.Default
    String version = "1.0.0";
}
