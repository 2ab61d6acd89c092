package io.specbridge.toolbox.remotehttp;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import io.specbridge.core.errors.MissingRequiredParameterError;
import io.specbridge.core.errors.ToolInvocationError;
import io.specbridge.core.errors.ToolNotFoundError;
import io.specbridge.core.invocation.InvocationResult;
import io.specbridge.core.tools.HttpMethod;
import io.specbridge.core.tools.ParameterLocation;
import io.specbridge.core.tools.ParameterSpec;
import io.specbridge.core.tools.ToolDefinition;
import io.specbridge.core.tools.ToolSchemas;
import io.specbridge.core.utils.JsonUtils;
import io.specbridge.core.utils.ToolUtils;
import io.specbridge.openapi.ToolCompiler;
import io.specbridge.openapi.config.OpenApiSourceConfig;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Turns a named tool invocation into exactly one HTTP call and classifies its outcome.
 * <p>
 * Unknown tools and missing required arguments are rejected with a {@link ToolInvocationError} before anything is
 * sent. Everything that goes wrong after that point is reported through the returned {@link InvocationResult}.
 * Header and cookie parameters are part of a tool's definition but are never forwarded; callers supplying them are
 * ignored. Instances hold no per-call state and can be shared between threads.
 */
@Slf4j
public class InvocationDispatcher {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Escaper PATH_ESCAPER = UrlEscapers.urlPathSegmentEscaper();

    private final String api;
    private final Map<String, ToolDefinition> tools;
    private final BaseUrlResolver baseUrlResolver;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final Map<String, String> headers;

    @Builder
    public InvocationDispatcher(
            @NonNull String api,
            @NonNull List<ToolDefinition> tools,
            @NonNull BaseUrlResolver baseUrlResolver,
            OkHttpClient httpClient,
            ObjectMapper mapper,
            Duration timeout,
            Map<String, String> headers) {
        final var effectiveTimeout = Objects.requireNonNullElseGet(
                timeout, () -> Duration.ofSeconds(OpenApiSourceConfig.DEFAULT_TIMEOUT_SECONDS));
        this.api = api;
        this.tools = ToolCompiler.index(tools);
        this.baseUrlResolver = baseUrlResolver;
        this.httpClient = Objects.requireNonNullElseGet(httpClient, OkHttpClient::new)
                .newBuilder()
                .callTimeout(effectiveTimeout)
                .readTimeout(effectiveTimeout)
                .connectTimeout(effectiveTimeout)
                .retryOnConnectionFailure(false)
                .build();
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.headers = Objects.requireNonNullElseGet(headers, Map::of);
    }

    /**
     * Maps arguments onto the request positions of a tool
     *
     * @param toolName  Name of the tool in the catalog
     * @param arguments Argument values keyed by parameter name. May be null.
     * @return The call to be made
     * @throws ToolNotFoundError              if the catalog has no such tool
     * @throws MissingRequiredParameterError if a required path, query or body argument is absent or null
     */
    public HttpCallSpec resolve(@NonNull String toolName, Map<String, Object> arguments) {
        final var tool = tools.get(toolName);
        if (null == tool) {
            throw new ToolNotFoundError(toolName);
        }
        final var args = Objects.requireNonNullElseGet(arguments, Map::<String, Object>of);
        var path = tool.getPathTemplate();
        for (final var parameter : tool.parametersIn(ParameterLocation.PATH)) {
            final var value = required(tool, parameter, args);
            path = ToolDefinition.substitute(path, parameter.getName(), PATH_ESCAPER.escape(value));
        }
        final var callSpec = HttpCallSpec.builder()
                .toolName(toolName)
                .method(tool.getHttpMethod())
                .path(path);
        for (final var parameter : tool.parametersIn(ParameterLocation.QUERY)) {
            final var value = args.get(parameter.getName());
            if (null == value) {
                ensureOptional(tool, parameter);
                continue;
            }
            callSpec.queryParameter(parameter.getName(), queryValues(value));
        }
        if (null != tool.getRequestBody()) {
            final var body = new LinkedHashMap<String, Object>();
            for (final var property : tool.bodyProperties()) {
                final var value = args.get(property.getName());
                if (null == value) {
                    ensureOptional(tool, property);
                    continue;
                }
                body.put(property.getName(), value);
            }
            callSpec.body(body);
        }
        logIgnoredArguments(tool, args);
        return callSpec.build();
    }

    /**
     * Invokes a tool and waits for the outcome
     *
     * @throws ToolNotFoundError              if the catalog has no such tool
     * @throws MissingRequiredParameterError if a required argument is missing
     */
    public InvocationResult dispatch(@NonNull String toolName, Map<String, Object> arguments) {
        final var spec = resolve(toolName, arguments);
        final Call call;
        try {
            call = httpClient.newCall(request(spec));
        }
        catch (Exception e) {
            log.error("Could not build request for tool {}: {}", toolName, ToolUtils.rootCauseMessage(e));
            return InvocationResult.unexpected(ToolUtils.rootCauseMessage(e));
        }
        try (final var response = call.execute()) {
            return classify(spec, response);
        }
        catch (IOException e) {
            return failure(spec, call.request().url(), e);
        }
    }

    /**
     * Invokes a tool without blocking. Cancelling the returned future aborts the underlying HTTP call.
     * Rejections that {@link #dispatch} throws complete the future exceptionally instead.
     */
    public CompletableFuture<InvocationResult> dispatchAsync(@NonNull String toolName, Map<String, Object> arguments) {
        final Call call;
        final HttpCallSpec spec;
        try {
            spec = resolve(toolName, arguments);
            call = httpClient.newCall(request(spec));
        }
        catch (ToolInvocationError e) {
            return CompletableFuture.failedFuture(e);
        }
        catch (Exception e) {
            return CompletableFuture.completedFuture(InvocationResult.unexpected(ToolUtils.rootCauseMessage(e)));
        }
        final var future = new CompletableFuture<InvocationResult>();
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                log.debug("Cancelling call for tool {}", toolName);
                call.cancel();
            }
        });
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                future.complete(failure(spec, failedCall.request().url(), e));
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (response) {
                    future.complete(classify(spec, response));
                }
                catch (Exception e) {
                    future.complete(failure(spec, completedCall.request().url(), e));
                }
            }
        });
        return future;
    }

    private Request request(HttpCallSpec spec) throws IOException {
        final var baseUrl = StringUtils.stripEnd(baseUrlResolver.resolve(api), "/");
        final var url = HttpUrl.parse(baseUrl + spec.getPath());
        if (null == url) {
            throw new IllegalArgumentException("Invalid URL: " + baseUrl + spec.getPath());
        }
        final var urlBuilder = url.newBuilder();
        Objects.requireNonNullElseGet(spec.getQuery(), Map::<String, List<String>>of)
                .forEach((name, values) -> values.forEach(value -> urlBuilder.addQueryParameter(name, value)));
        final var requestBuilder = new Request.Builder()
                .url(urlBuilder.build())
                .header("Accept", "application/json");
        headers.forEach(requestBuilder::header);
        log.debug("Calling {} {} for tool {}", spec.getMethod(), spec.getPath(), spec.getToolName());
        final var method = spec.getMethod();
        final var noBody = null == spec.getBody() || spec.getBody().isEmpty();
        if (!method.allowsBody() || (method == HttpMethod.DELETE && noBody)) {
            return requestBuilder.method(method.name(), null).build();
        }
        return requestBuilder.method(method.name(), body(spec)).build();
    }

    private RequestBody body(HttpCallSpec spec) throws IOException {
        if (null == spec.getBody() || spec.getBody().isEmpty()) {
            return RequestBody.create(new byte[0], null);
        }
        return RequestBody.create(mapper.writeValueAsBytes(spec.getBody()), JSON);
    }

    private InvocationResult classify(HttpCallSpec spec, Response response) throws IOException {
        final var responseBody = response.body();
        final var text = null == responseBody ? "" : responseBody.string();
        if (response.isSuccessful()) {
            return parse(text)
                    .map(json -> InvocationResult.passthrough(json, response.code()))
                    .orElseGet(() -> InvocationResult.text(text, response.code()));
        }
        log.warn("Tool {}: {} {} returned HTTP {}", spec.getToolName(), spec.getMethod(), spec.getPath(),
                 response.code());
        final var detail = parse(text)
                .orElseGet(() -> StringUtils.isBlank(text) ? null : TextNode.valueOf(text));
        return InvocationResult.httpFailure(spec.getMethod(), spec.getPath(), response.code(), detail);
    }

    private InvocationResult failure(HttpCallSpec spec, HttpUrl url, Exception e) {
        final var cause = ToolUtils.rootCause(e);
        if (cause instanceof ConnectException
                || cause instanceof UnknownHostException
                || cause instanceof NoRouteToHostException) {
            log.warn("Tool {}: could not reach {}: {}", spec.getToolName(), url, cause.getMessage());
            return InvocationResult.unreachable(hostLabel(url));
        }
        log.warn("Tool {}: {} {} failed: {}", spec.getToolName(), spec.getMethod(), spec.getPath(),
                 ToolUtils.rootCauseMessage(e));
        return InvocationResult.unexpected(ToolUtils.rootCauseMessage(e));
    }

    private Optional<JsonNode> parse(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readTree(text));
        }
        catch (JacksonException e) {
            return Optional.empty();
        }
    }

    private static void logIgnoredArguments(ToolDefinition tool, Map<String, Object> args) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final var accepted = ToolSchemas.arguments(tool)
                .stream()
                .map(ParameterSpec::getName)
                .collect(Collectors.toSet());
        args.keySet()
                .stream()
                .filter(name -> !accepted.contains(name))
                .forEach(name -> tool.getParameters()
                        .stream()
                        .filter(parameter -> parameter.getName().equals(name))
                        .findFirst()
                        .ifPresentOrElse(
                                parameter -> log.debug("Tool {}: {} parameter {} is not forwarded",
                                                       tool.getName(), parameter.getLocation().getValue(), name),
                                () -> log.debug("Tool {}: ignoring undeclared argument {}",
                                                tool.getName(), name)));
    }

    private static String required(ToolDefinition tool, ParameterSpec parameter, Map<String, Object> args) {
        final var value = args.get(parameter.getName());
        if (null == value) {
            throw new MissingRequiredParameterError(tool.getName(), parameter.getName());
        }
        return scalar(value);
    }

    private static void ensureOptional(ToolDefinition tool, ParameterSpec parameter) {
        if (parameter.isRequired()) {
            throw new MissingRequiredParameterError(tool.getName(), parameter.getName());
        }
    }

    private static List<String> queryValues(Object value) {
        final var values = new ArrayList<String>();
        if (value instanceof Collection<?> collection) {
            collection.stream()
                    .filter(Objects::nonNull)
                    .forEach(item -> values.add(scalar(item)));
        }
        else if (value instanceof JsonNode node && node.isArray()) {
            node.forEach(item -> {
                if (!item.isNull()) {
                    values.add(scalar(item));
                }
            });
        }
        else {
            values.add(scalar(value));
        }
        return values;
    }

    private static String scalar(Object value) {
        if (value instanceof JsonNode node) {
            return node.isValueNode() ? node.asText() : node.toString();
        }
        return String.valueOf(value);
    }

    private static String hostLabel(HttpUrl url) {
        return url.port() == HttpUrl.defaultPort(url.scheme())
               ? url.host()
               : url.host() + ":" + url.port();
    }
}
