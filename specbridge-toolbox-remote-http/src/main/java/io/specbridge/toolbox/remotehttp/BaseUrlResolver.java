package io.specbridge.toolbox.remotehttp;

import com.google.common.base.Strings;

/**
 * Resolves the base URL calls for an API are sent to. Useful when the address of an API is only known at runtime,
 * for example from service discovery.
 */
@FunctionalInterface
public interface BaseUrlResolver {
    String resolve(String api);

    /**
     * Creates a resolver that always returns the given URL
     *
     * @param url The URL to return for any API
     * @return An instance of {@link BaseUrlResolver} that returns back the given URL
     */
    static BaseUrlResolver direct(String url) {
        return api -> {
            if (Strings.isNullOrEmpty(api)) {
                throw new IllegalArgumentException("API name cannot be null or empty");
            }
            return url;
        };
    }
}
