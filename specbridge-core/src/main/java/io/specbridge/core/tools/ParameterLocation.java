package io.specbridge.core.tools;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Where a declared parameter goes in the HTTP request. Header and cookie parameters are recognized in the document
 * but are never forwarded by the dispatcher.
 */
@Getter
@AllArgsConstructor
public enum ParameterLocation {
    PATH("path", true),
    QUERY("query", true),
    HEADER("header", false),
    COOKIE("cookie", false);

    private final String value;
    private final boolean forwarded;

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ParameterLocation> fromValue(String value) {
        return Arrays.stream(values())
                .filter(location -> location.value.equalsIgnoreCase(value))
                .findFirst();
    }
}
