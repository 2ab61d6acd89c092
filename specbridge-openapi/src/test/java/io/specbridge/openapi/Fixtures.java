package io.specbridge.openapi;

import io.specbridge.openapi.loader.SpecLoader;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Access to the documents under <code>src/test/resources/specs</code>
 */
@UtilityClass
public class Fixtures {
    public static final String PROCUREMENT = "/specs/procurement.json";
    public static final String INVENTORY = "/specs/inventory.yaml";
    public static final String SHIPPING = "/specs/shipping.yaml";

    @SneakyThrows
    public static Path path(String resource) {
        return Path.of(Objects.requireNonNull(Fixtures.class.getResource(resource), resource).toURI());
    }

    @SneakyThrows
    public static String content(String resource) {
        return Files.readString(path(resource));
    }

    public static ApiDocument document(String resource) {
        return SpecLoader.builder().build().loadFromFile(path(resource));
    }
}
