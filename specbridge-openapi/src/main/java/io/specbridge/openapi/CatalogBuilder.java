package io.specbridge.openapi;

import io.specbridge.core.errors.CatalogConfigurationError;
import io.specbridge.core.utils.JsonUtils;
import io.specbridge.openapi.config.ApiServerConfig;
import io.specbridge.openapi.loader.SpecLoader;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import org.apache.commons.lang3.StringUtils;

/**
 * Loads and compiles the API description of a configured server into a {@link CompiledCatalog}
 */
@UtilityClass
@Slf4j
public class CatalogBuilder {

    public static CompiledCatalog build(@NonNull ApiServerConfig server, @NonNull SpecLoader loader) {
        final var source = server.getOpenapi();
        if (null == source) {
            throw new CatalogConfigurationError("No openapi section configured for server " + server.getName());
        }
        final var document = loader.load(source);
        final var generation = server.effectiveToolGeneration();
        return build(document,
                     source.getBaseUrl(),
                     ToolCompiler.from(generation),
                     InclusionPolicy.from(generation));
    }

    public static CompiledCatalog build(
            @NonNull ApiDocument document,
            String configuredBaseUrl,
            @NonNull ToolCompiler compiler,
            @NonNull InclusionPolicy inclusionPolicy) {
        final var apiInfo = document.info();
        final var tools = compiler.compile(document, inclusionPolicy);
        final var baseUrl = baseUrl(document, configuredBaseUrl);
        log.info("Compiled {} tools for API '{}' {} with base URL '{}'",
                 tools.size(), apiInfo.getTitle(), apiInfo.getVersion(), baseUrl);
        return CompiledCatalog.builder()
                .apiInfo(apiInfo)
                .baseUrl(baseUrl)
                .tools(tools)
                .schemas(JsonUtils.copy(document.schemas()))
                .build();
    }

    /**
     * The configured base URL, else the first server URL of the document. A relative server URL is resolved against
     * the URL the document was fetched from. Trailing slashes are removed.
     */
    public static String baseUrl(@NonNull ApiDocument document, String configuredBaseUrl) {
        if (StringUtils.isNotBlank(configuredBaseUrl)) {
            return StringUtils.stripEnd(configuredBaseUrl.strip(), "/");
        }
        final var serverUrl = document.firstServerUrl().orElse("");
        if (null != HttpUrl.parse(serverUrl)) {
            return StringUtils.stripEnd(serverUrl, "/");
        }
        final var source = null == document.getSourceUrl() ? null : HttpUrl.parse(document.getSourceUrl());
        if (null == source) {
            if (StringUtils.isBlank(serverUrl)) {
                log.warn("No base URL configured and the document declares no servers");
            }
            else {
                log.warn("Relative server URL {} cannot be resolved without a document URL", serverUrl);
            }
            return StringUtils.stripEnd(serverUrl, "/");
        }
        final var resolved = source.resolve(StringUtils.isBlank(serverUrl) ? "/" : serverUrl);
        return null == resolved ? "" : StringUtils.stripEnd(resolved.toString(), "/");
    }
}
