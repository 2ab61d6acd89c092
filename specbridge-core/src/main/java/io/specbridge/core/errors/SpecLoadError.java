package io.specbridge.core.errors;

/**
 * The API description could not be obtained or decoded. Missing file, unreachable URL, undecodable content or a
 * documentation page from which no document URL could be discovered.
 */
public class SpecLoadError extends RuntimeException {
    public SpecLoadError(final String message) {
        super(message);
    }

    public SpecLoadError(final String message, final Throwable cause) {
        super(message, cause);
    }
}
