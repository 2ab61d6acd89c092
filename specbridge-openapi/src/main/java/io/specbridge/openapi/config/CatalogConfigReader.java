package io.specbridge.openapi.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.specbridge.core.errors.CatalogConfigurationError;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link CatalogConfiguration} from YAML (or JSON, which is valid YAML)
 */
@UtilityClass
public class CatalogConfigReader {

    public static CatalogConfiguration read(final Path path) {
        if (!Files.isRegularFile(path)) {
            throw new CatalogConfigurationError("Configuration file not found: " + path);
        }
        try {
            return read(Files.readAllBytes(path));
        }
        catch (IOException e) {
            throw new CatalogConfigurationError("Could not read configuration file " + path, e);
        }
    }

    public static CatalogConfiguration read(final byte[] content) {
        final var yamlMapper = new YAMLMapper();
        yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            final var configuration = yamlMapper.readValue(content, CatalogConfiguration.class);
            if (null == configuration) {
                throw new CatalogConfigurationError("Configuration is empty");
            }
            return configuration;
        }
        catch (IOException e) {
            throw new CatalogConfigurationError("Invalid configuration: " + e.getMessage(), e);
        }
    }
}
