package io.specbridge.openapi.loader;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.specbridge.core.errors.SpecLoadError;
import io.specbridge.core.utils.JsonUtils;
import io.specbridge.core.utils.ToolUtils;
import io.specbridge.openapi.ApiDocument;
import io.specbridge.openapi.config.OpenApiSourceConfig;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Obtains an API description from a local file, a direct document URL or an HTML documentation page.
 * <p>
 * For a documentation page the document URL is looked up, once each and in this order, in the page itself, in its
 * non-library scripts and finally at a fixed list of conventional locations on the same host. Loading fails with
 * {@link SpecLoadError} once all of them are exhausted.
 */
@Slf4j
public class SpecLoader {
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final YAMLMapper yamlMapper;
    private final Map<String, String> headers;

    private record Fetched(int code, MediaType contentType, String body) {
        boolean successful() {
            return code >= 200 && code < 300;
        }
    }

    @Builder
    public SpecLoader(OkHttpClient httpClient, ObjectMapper mapper, Duration timeout, Map<String, String> headers) {
        final var effectiveTimeout = Objects.requireNonNullElseGet(
                timeout, () -> Duration.ofSeconds(OpenApiSourceConfig.DEFAULT_TIMEOUT_SECONDS));
        this.httpClient = Objects.requireNonNullElseGet(httpClient, OkHttpClient::new)
                .newBuilder()
                .connectTimeout(effectiveTimeout)
                .readTimeout(effectiveTimeout)
                .callTimeout(effectiveTimeout)
                .followRedirects(true)
                .build();
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.yamlMapper = new YAMLMapper();
        this.headers = Objects.requireNonNullElseGet(headers, Map::of);
    }

    public static SpecLoader from(@NonNull OpenApiSourceConfig source, OkHttpClient httpClient, ObjectMapper mapper) {
        return new SpecLoader(httpClient, mapper, source.timeoutDuration(), source.getHeaders());
    }

    /**
     * Loads the configured document. A file takes precedence over a URL.
     */
    public ApiDocument load(@NonNull OpenApiSourceConfig source) {
        if (StringUtils.isNotBlank(source.getOpenapiFile())) {
            return loadFromFile(Path.of(source.getOpenapiFile()));
        }
        if (StringUtils.isNotBlank(source.getOpenapiUrl())) {
            return loadFromUrl(source.getOpenapiUrl());
        }
        throw new SpecLoadError("Either openapi_file or openapi_url must be configured");
    }

    public ApiDocument loadFromFile(@NonNull Path path) {
        if (!Files.isRegularFile(path)) {
            throw new SpecLoadError("OpenAPI document file not found: " + path);
        }
        final var fileName = path.getFileName().toString().toLowerCase();
        final JsonNode root;
        try {
            final var content = Files.readAllBytes(path);
            root = fileName.endsWith(".yaml") || fileName.endsWith(".yml")
                   ? yamlMapper.readTree(content)
                   : mapper.readTree(content);
        }
        catch (IOException e) {
            throw new SpecLoadError("Could not read OpenAPI document file %s: %s"
                                            .formatted(path, ToolUtils.rootCauseMessage(e)), e);
        }
        if (null == root || !root.isObject()) {
            throw new SpecLoadError("OpenAPI document file %s does not contain an object".formatted(path));
        }
        log.info("Loaded OpenAPI document from file {}", path);
        return ApiDocument.of(root);
    }

    public ApiDocument loadFromUrl(@NonNull String url) {
        final var pageUrl = HttpUrl.parse(url);
        if (null == pageUrl) {
            throw new SpecLoadError("Invalid OpenAPI document URL: " + url);
        }
        final var fetched = fetchOrFail(pageUrl);
        final var contentType = fetched.contentType();
        if (isJson(contentType)) {
            log.info("Loaded OpenAPI document from {}", pageUrl);
            return new ApiDocument(parseJson(fetched.body(), pageUrl), pageUrl.toString());
        }
        if (isHtml(contentType)) {
            return discover(pageUrl, fetched.body());
        }
        return parseDocument(fetched.body())
                .map(root -> new ApiDocument(root, pageUrl.toString()))
                .orElseThrow(() -> new SpecLoadError(
                        "Could not decode content of %s as an OpenAPI document. Content-Type: %s"
                                .formatted(pageUrl, contentType)));
    }

    private ApiDocument discover(HttpUrl pageUrl, String html) {
        final var hostRoot = pageUrl.newBuilder()
                .encodedPath("/")
                .query(null)
                .fragment(null)
                .build();
        final var specUrl = DocsPageScanner.findSpecUrl(html)
                .or(() -> findInScripts(hostRoot, html));
        if (specUrl.isEmpty()) {
            return probeWellKnownPaths(hostRoot)
                    .orElseThrow(() -> new SpecLoadError(
                            ("Could not discover the OpenAPI document URL from %s. Provide the document URL directly "
                                    + "or download the document and configure openapi_file").formatted(pageUrl)));
        }
        final var documentUrl = hostRoot.resolve(specUrl.get());
        if (null == documentUrl) {
            throw new SpecLoadError("Invalid OpenAPI document URL %s found on %s".formatted(specUrl.get(), pageUrl));
        }
        log.info("Discovered OpenAPI document URL {} from {}", documentUrl, pageUrl);
        final var fetched = fetchOrFail(documentUrl);
        return parseDocument(fetched.body())
                .map(root -> new ApiDocument(root, documentUrl.toString()))
                .orElseThrow(() -> new SpecLoadError(
                        "Content of discovered URL %s is not a JSON or YAML document".formatted(documentUrl)));
    }

    private Optional<String> findInScripts(HttpUrl hostRoot, String html) {
        for (final var script : DocsPageScanner.configurationScripts(html)) {
            final var scriptUrl = hostRoot.resolve(script);
            if (null == scriptUrl) {
                continue;
            }
            try {
                final var fetched = fetch(scriptUrl);
                if (fetched.code() != 200) {
                    continue;
                }
                final var found = DocsPageScanner.findSpecUrl(fetched.body());
                if (found.isPresent()) {
                    log.info("Found OpenAPI document URL in script {}", scriptUrl);
                    return found;
                }
            }
            catch (IOException e) {
                log.debug("Could not fetch script {}: {}", scriptUrl, ToolUtils.rootCauseMessage(e));
            }
        }
        return Optional.empty();
    }

    private Optional<ApiDocument> probeWellKnownPaths(HttpUrl hostRoot) {
        for (final var path : DocsPageScanner.WELL_KNOWN_PATHS) {
            final var candidate = hostRoot.resolve(path);
            if (null == candidate) {
                continue;
            }
            try {
                final var fetched = fetch(candidate);
                if (fetched.code() != 200) {
                    continue;
                }
                final var document = parseDocument(fetched.body())
                        .filter(SpecLoader::declaresVersion);
                if (document.isPresent()) {
                    log.info("Found OpenAPI document at {}", candidate);
                    return Optional.of(new ApiDocument(document.get(), candidate.toString()));
                }
            }
            catch (IOException e) {
                log.debug("Probe of {} failed: {}", candidate, ToolUtils.rootCauseMessage(e));
            }
        }
        return Optional.empty();
    }

    private Fetched fetchOrFail(HttpUrl url) {
        final Fetched fetched;
        try {
            fetched = fetch(url);
        }
        catch (IOException e) {
            final var cause = ToolUtils.rootCause(e);
            if (cause instanceof ConnectException || cause instanceof UnknownHostException) {
                throw new SpecLoadError("Could not connect to OpenAPI document URL: " + url, e);
            }
            throw new SpecLoadError("Failed to load OpenAPI document from %s: %s"
                                            .formatted(url, ToolUtils.rootCauseMessage(e)), e);
        }
        if (!fetched.successful()) {
            throw new SpecLoadError("Fetching OpenAPI document from %s failed (HTTP %d)".formatted(url, fetched.code()));
        }
        return fetched;
    }

    private Fetched fetch(HttpUrl url) throws IOException {
        final var requestBuilder = new Request.Builder()
                .url(url)
                .get();
        headers.forEach(requestBuilder::header);
        try (final var response = httpClient.newCall(requestBuilder.build()).execute()) {
            final var body = response.body();
            return new Fetched(response.code(),
                               null == body ? null : body.contentType(),
                               null == body ? "" : body.string());
        }
    }

    private JsonNode parseJson(String body, HttpUrl url) {
        try {
            final var root = mapper.readTree(body);
            if (null == root || !root.isObject()) {
                throw new SpecLoadError("Content of %s is not a JSON object".formatted(url));
            }
            return root;
        }
        catch (JacksonException e) {
            throw new SpecLoadError("Content of %s is not valid JSON: %s".formatted(url, e.getOriginalMessage()), e);
        }
    }

    /**
     * Any JSON object, or a YAML object declaring an <code>openapi</code> or <code>swagger</code> version
     */
    private Optional<JsonNode> parseDocument(String body) {
        if (StringUtils.isBlank(body)) {
            return Optional.empty();
        }
        try {
            final var root = mapper.readTree(body);
            if (null != root && root.isObject()) {
                return Optional.of(root);
            }
        }
        catch (JacksonException e) {
            log.debug("Content is not JSON, trying YAML: {}", e.getOriginalMessage());
        }
        try {
            return Optional.ofNullable(yamlMapper.readTree(body))
                    .filter(JsonNode::isObject)
                    .filter(SpecLoader::declaresVersion);
        }
        catch (JacksonException e) {
            log.debug("Content is not YAML either: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static boolean declaresVersion(JsonNode root) {
        return root.has("openapi") || root.has("swagger");
    }

    private static boolean isJson(MediaType contentType) {
        return null != contentType
                && ("json".equalsIgnoreCase(contentType.subtype()) || contentType.subtype().endsWith("+json"));
    }

    private static boolean isHtml(MediaType contentType) {
        return null != contentType && "html".equalsIgnoreCase(contentType.subtype());
    }
}
