package io.specbridge.openapi;

import io.specbridge.openapi.config.ToolGenerationConfig;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which operations of a document become tools. Entries match either the declared operation identifier or
 * the raw path. A matching exclusion always wins.
 */
@Value
@Builder
public class InclusionPolicy {
    @Builder.Default
    boolean includeAll = true;

    @Singular("include")
    Set<String> includes;

    @Singular("exclude")
    Set<String> excludes;

    public static InclusionPolicy includeAll() {
        return InclusionPolicy.builder().build();
    }

    public static InclusionPolicy from(ToolGenerationConfig config) {
        return InclusionPolicy.builder()
                .includeAll(config.isIncludeAll())
                .includes(Objects.requireNonNullElseGet(config.getIncludeEndpoints(), List::<String>of))
                .excludes(Objects.requireNonNullElseGet(config.getExcludeEndpoints(), List::<String>of))
                .build();
    }

    public boolean includes(String operationId, String path) {
        if (matches(excludes, operationId, path)) {
            return false;
        }
        return includeAll || matches(includes, operationId, path);
    }

    private static boolean matches(Set<String> entries, String operationId, String path) {
        return (null != operationId && entries.contains(operationId)) || entries.contains(path);
    }
}
