package io.specbridge.toolbox.remotehttp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.specbridge.openapi.config.ApiServerConfig;
import io.specbridge.openapi.config.CatalogConfiguration;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Creates {@link OpenApiToolBox} instances for the enabled <code>openapi</code> servers of a
 * {@link CatalogConfiguration}. Servers of other types are skipped.
 */
@Slf4j
public class OpenApiToolBoxFactory {
    private final Function<String, OkHttpClient> okHttpClientProvider;

    @NonNull
    private final ObjectMapper objectMapper;

    @NonNull
    private final CatalogConfiguration configuration;

    @Builder(builderClassName = "DefaultOpenApiToolBoxFactoryBuilder")
    public OpenApiToolBoxFactory(
            @NonNull OkHttpClient okHttpClient,
            @NonNull ObjectMapper objectMapper,
            @NonNull CatalogConfiguration configuration) {
        this(name -> okHttpClient, objectMapper, configuration);
    }

    @Builder(builderClassName = "ProvidingOpenApiToolBoxFactoryBuilder",
            builderMethodName = "httpClientProvidingBuilder")
    public OpenApiToolBoxFactory(
            @NonNull Function<String, OkHttpClient> okHttpClientProvider,
            @NonNull ObjectMapper objectMapper,
            @NonNull CatalogConfiguration configuration) {
        this.okHttpClientProvider = okHttpClientProvider;
        this.objectMapper = objectMapper;
        this.configuration = configuration;
    }

    /**
     * Names of the enabled servers a toolbox can be created for
     */
    public List<String> servers() {
        return openApiServers().stream()
                .map(ApiServerConfig::getName)
                .filter(Objects::nonNull)
                .toList();
    }

    public Optional<OpenApiToolBox> create(@NonNull final String serverName) {
        return openApiServers()
                .stream()
                .filter(server -> serverName.equals(server.getName()))
                .findFirst()
                .map(this::toolBox);
    }

    /**
     * Creates toolboxes for all enabled servers, in configuration order
     *
     * @throws io.specbridge.core.errors.SpecLoadError if the document of any server cannot be loaded
     */
    public List<OpenApiToolBox> createAll() {
        return openApiServers().stream()
                .map(this::toolBox)
                .toList();
    }

    private OpenApiToolBox toolBox(ApiServerConfig server) {
        final var clientKey = Objects.requireNonNullElse(server.getName(), "");
        return OpenApiToolBox.from(server,
                                   Objects.requireNonNull(okHttpClientProvider.apply(clientKey),
                                                          "Could not resolve http client for server: " + clientKey),
                                   objectMapper);
    }

    private List<ApiServerConfig> openApiServers() {
        return configuration.enabledServers()
                .stream()
                .filter(server -> {
                    if (!server.isOpenApi()) {
                        log.warn("Skipping server {} of unsupported type {}", server.getName(), server.getType());
                        return false;
                    }
                    return true;
                })
                .toList();
    }
}
