package io.specbridge.core.errors;

import lombok.Getter;

/**
 * An internal <code>$ref</code> pointer does not designate anything in the document. Only raised when strict
 * reference resolution is enabled.
 */
@Getter
public class UnresolvedReferenceError extends RuntimeException {
    private final String pointer;

    public UnresolvedReferenceError(final String pointer, final String reason) {
        super("Could not resolve reference %s: %s".formatted(pointer, reason));
        this.pointer = pointer;
    }
}
