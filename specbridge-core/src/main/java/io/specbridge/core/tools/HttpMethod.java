package io.specbridge.core.tools;

/**
 * HTTP methods for which tools are compiled. Declaration order is the order in which methods are visited under a
 * path entry.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    public String lowerCase() {
        return name().toLowerCase();
    }

    public boolean allowsBody() {
        return this != GET;
    }
}
