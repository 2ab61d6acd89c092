package io.specbridge.toolbox.remotehttp;

import io.specbridge.core.tools.ToolDefinition;
import io.specbridge.openapi.InclusionPolicy;
import io.specbridge.openapi.ToolCompiler;
import io.specbridge.openapi.config.ToolGenerationConfig;
import io.specbridge.openapi.loader.SpecLoader;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Test documents and the tools compiled from them
 */
@UtilityClass
class TestResources {
    static final String PROCUREMENT = "/specs/procurement.json";

    @SneakyThrows
    static Path path(String resource) {
        return Path.of(Objects.requireNonNull(TestResources.class.getResource(resource), resource).toURI());
    }

    @SneakyThrows
    static String content(String resource) {
        return Files.readString(path(resource));
    }

    static List<ToolDefinition> procurementTools() {
        final var document = SpecLoader.builder().build().loadFromFile(path(PROCUREMENT));
        return ToolCompiler.from(ToolGenerationConfig.defaults())
                .compile(document, InclusionPolicy.includeAll());
    }
}
