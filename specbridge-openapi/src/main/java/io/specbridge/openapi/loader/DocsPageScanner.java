package io.specbridge.openapi.loader;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the API description URL referenced by a Swagger UI / ReDoc page or by one of its configuration scripts
 */
@UtilityClass
public class DocsPageScanner {
    private static final List<Pattern> SPEC_URL_PATTERNS = List.of(
            Pattern.compile("url:\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"url\"\\s*:\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE),
            Pattern.compile("'url'\\s*:\\s*'([^']+)'", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\{\\s*url:\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE),
            Pattern.compile("spec-url\\s*=\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE));

    private static final Pattern SCRIPT_SOURCE = Pattern.compile(
            "<script[^>]+src\\s*=\\s*[\"']([^\"']+)[\"'][^>]*>", Pattern.CASE_INSENSITIVE);

    private static final List<String> STATIC_ASSET_EXTENSIONS = List.of(
            ".css", ".js", ".png", ".jpg", ".ico", ".svg", ".woff", ".ttf");
    private static final List<String> EXCLUDED_FRAGMENTS = List.of("fonts.googleapis", "swagger-ui", "favicon");
    private static final List<String> PREFERRED_KEYWORDS = List.of(
            "openapi", "swagger", "api-docs", "apidoc", "/api/", "/v1/", "/v2/", "/v3/");
    private static final List<String> LIBRARY_SCRIPTS = List.of(
            "swagger-ui-bundle", "swagger-ui-standalone", "jquery", "bootstrap");

    /**
     * Conventional locations probed, relative to the host root, when a page references no document
     */
    public static final List<String> WELL_KNOWN_PATHS = List.of(
            "/openapi.json",
            "/swagger.json",
            "/api/openapi.json",
            "/api/swagger.json",
            "/apidoc/v1",
            "/v1/openapi.json",
            "/v2/openapi.json",
            "/v3/openapi.json",
            "/api-docs",
            "/api-docs.json",
            "/docs/openapi.json");

    /**
     * First candidate in the content that looks like a document URL. Patterns are tried in a fixed order.
     */
    public static Optional<String> findSpecUrl(String content) {
        if (null == content || content.isEmpty()) {
            return Optional.empty();
        }
        for (final var pattern : SPEC_URL_PATTERNS) {
            final var matcher = pattern.matcher(content);
            while (matcher.find()) {
                final var candidate = matcher.group(1).trim();
                if (isLikelySpecUrl(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    public static boolean isLikelySpecUrl(String url) {
        final var lower = url.toLowerCase();
        if (STATIC_ASSET_EXTENSIONS.stream().anyMatch(lower::endsWith)
                || EXCLUDED_FRAGMENTS.stream().anyMatch(lower::contains)) {
            return false;
        }
        return PREFERRED_KEYWORDS.stream().anyMatch(lower::contains) || url.startsWith("/");
    }

    /**
     * Sources of external scripts of the page, skipping well known UI libraries
     */
    public static List<String> configurationScripts(String html) {
        final var scripts = new ArrayList<String>();
        final var matcher = SCRIPT_SOURCE.matcher(html);
        while (matcher.find()) {
            final var source = matcher.group(1);
            final var lower = source.toLowerCase();
            if (LIBRARY_SCRIPTS.stream().noneMatch(lower::contains)) {
                scripts.add(source);
            }
        }
        return scripts;
    }
}
