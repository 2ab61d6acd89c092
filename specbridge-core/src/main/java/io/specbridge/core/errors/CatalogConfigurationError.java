package io.specbridge.core.errors;

/**
 * Invalid or unreadable catalog configuration
 */
public class CatalogConfigurationError extends RuntimeException {
    public CatalogConfigurationError(final String message) {
        super(message);
    }

    public CatalogConfigurationError(final String message, final Throwable cause) {
        super(message, cause);
    }
}
