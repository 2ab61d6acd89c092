package io.specbridge.toolbox.remotehttp;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specbridge.core.errors.CatalogConfigurationError;
import io.specbridge.core.errors.ToolInvocationError;
import io.specbridge.core.invocation.InvocationResult;
import io.specbridge.core.tools.CatalogSummarizer;
import io.specbridge.core.tools.ToolDefinition;
import io.specbridge.core.tools.ToolSchemas;
import io.specbridge.core.utils.JsonUtils;
import io.specbridge.openapi.CatalogBuilder;
import io.specbridge.openapi.CompiledCatalog;
import io.specbridge.openapi.config.ApiServerConfig;
import io.specbridge.openapi.loader.SpecLoader;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Exposes the operations of one API as a catalog of tools that can be listed and invoked by name.
 * <p>
 * Invocations never throw: every failure, including unknown tools and missing arguments, comes back as a
 * <code>{success: false, error, ...}</code> JSON value.
 */
@Slf4j
public class OpenApiToolBox {
    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final String name;
    @Getter
    private final String description;
    @Getter
    private final CompiledCatalog catalog;
    private final InvocationDispatcher dispatcher;
    private final ObjectMapper mapper;

    @Builder
    public OpenApiToolBox(
            String name,
            String description,
            @NonNull CompiledCatalog catalog,
            OkHttpClient httpClient,
            ObjectMapper mapper,
            BaseUrlResolver baseUrlResolver,
            Duration timeout,
            Map<String, String> headers) {
        this.name = StringUtils.isBlank(name) ? catalog.getApiInfo().getTitle() : name;
        this.description = StringUtils.isBlank(description) ? catalog.getApiInfo().getDescription() : description;
        this.catalog = catalog;
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.dispatcher = InvocationDispatcher.builder()
                .api(this.name)
                .tools(catalog.getTools())
                .baseUrlResolver(Objects.requireNonNullElseGet(baseUrlResolver,
                                                               () -> BaseUrlResolver.direct(catalog.getBaseUrl())))
                .httpClient(httpClient)
                .mapper(this.mapper)
                .timeout(timeout)
                .headers(headers)
                .build();
    }

    /**
     * Loads and compiles the API description of a configured server
     *
     * @param server     Server configuration
     * @param httpClient Client used for fetching the document and for tool calls
     * @param mapper     Mapper for requests and results
     * @return A toolbox for the server
     * @throws io.specbridge.core.errors.SpecLoadError if the document cannot be obtained
     */
    public static OpenApiToolBox from(@NonNull ApiServerConfig server, OkHttpClient httpClient, ObjectMapper mapper) {
        final var source = server.getOpenapi();
        if (null == source) {
            throw new CatalogConfigurationError("No openapi section configured for server " + server.getName());
        }
        final var catalog = CatalogBuilder.build(server, SpecLoader.from(source, httpClient, mapper));
        log.info("Created toolbox '{}' with {} tools", server.getName(), catalog.getTools().size());
        return OpenApiToolBox.builder()
                .name(server.getName())
                .description(server.getDescription())
                .catalog(catalog)
                .httpClient(httpClient)
                .mapper(mapper)
                .timeout(source.timeoutDuration())
                .headers(source.getHeaders())
                .build();
    }

    public String name() {
        return name;
    }

    public List<ToolDefinition> list() {
        return catalog.getTools();
    }

    public Optional<ToolDefinition> tool(String toolName) {
        return catalog.tool(toolName);
    }

    /**
     * JSON schema of the arguments a tool accepts
     */
    public Optional<ObjectNode> inputSchema(String toolName) {
        return tool(toolName).map(tool -> ToolSchemas.inputSchema(tool, mapper));
    }

    /**
     * Short grouped listing of all tools, meant to be shown once at the start of a session
     */
    public String summary() {
        return catalog.summary();
    }

    /**
     * Detailed listing with paths and parameters
     */
    public String describe() {
        return CatalogSummarizer.describe(catalog.getTools());
    }

    public JsonNode invoke(@NonNull String toolName, Map<String, Object> arguments) {
        return invocation(toolName, arguments).toJson(mapper);
    }

    /**
     * Invokes a tool with arguments given as a JSON object
     *
     * @param toolName  Name of the tool
     * @param arguments JSON object text. Blank means no arguments.
     * @return The result serialized as JSON
     */
    @SneakyThrows
    public String invoke(@NonNull String toolName, String arguments) {
        final InvocationResult result;
        if (StringUtils.isBlank(arguments)) {
            result = invocation(toolName, Map.of());
        }
        else {
            Map<String, Object> parsed = null;
            String parseError = null;
            try {
                parsed = mapper.readValue(arguments, ARGUMENTS_TYPE);
            }
            catch (JacksonException e) {
                parseError = "Invalid arguments for tool %s: %s".formatted(toolName, e.getOriginalMessage());
                log.warn(parseError);
            }
            result = null == parseError
                     ? invocation(toolName, parsed)
                     : InvocationResult.unexpected(parseError);
        }
        return mapper.writeValueAsString(result.toJson(mapper));
    }

    /**
     * Invokes a tool without blocking. Cancelling the returned future aborts the HTTP call.
     */
    public CompletableFuture<JsonNode> invokeAsync(@NonNull String toolName, Map<String, Object> arguments) {
        final var call = dispatcher.dispatchAsync(toolName, arguments);
        final var result = call
                .exceptionally(error -> {
                    final var cause = error instanceof CompletionException ? error.getCause() : error;
                    if (cause instanceof ToolInvocationError invocationError) {
                        log.warn("Rejected call to tool {}: {}", toolName, invocationError.getMessage());
                        return InvocationResult.rejected(invocationError);
                    }
                    throw new CompletionException(cause);
                })
                .thenApply(invocationResult -> invocationResult.toJson(mapper));
        result.whenComplete((json, error) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
        return result;
    }

    private InvocationResult invocation(String toolName, Map<String, Object> arguments) {
        try {
            return dispatcher.dispatch(toolName, arguments);
        }
        catch (ToolInvocationError e) {
            log.warn("Rejected call to tool {}: {}", toolName, e.getMessage());
            return InvocationResult.rejected(e);
        }
    }
}
