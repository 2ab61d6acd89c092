package io.specbridge.toolbox.remotehttp;

import io.specbridge.core.utils.JsonUtils;
import io.specbridge.openapi.config.ApiServerConfig;
import io.specbridge.openapi.config.CatalogConfiguration;
import io.specbridge.openapi.config.OpenApiSourceConfig;
import io.specbridge.openapi.config.ToolGenerationConfig;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests {@link OpenApiToolBoxFactory}
 */
@SuppressWarnings("unchecked")
class OpenApiToolBoxFactoryTest {

    @Test
    void testCreatesOnlyEnabledOpenApiServers() {
        final var factory = OpenApiToolBoxFactory.builder()
                .okHttpClient(new OkHttpClient())
                .objectMapper(JsonUtils.createMapper())
                .configuration(configuration())
                .build();
        assertEquals(List.of("procurement"), factory.servers());
        final var toolBox = factory.create("procurement").orElseThrow();
        assertEquals(1, toolBox.list().size());
        assertEquals("proc_health", toolBox.list().get(0).getName());
        assertTrue(factory.create("weather").isEmpty());
        assertTrue(factory.create("archived").isEmpty());
        assertEquals(1, factory.createAll().size());
    }

    @Test
    void testHttpClientIsProvidedPerServer() {
        final Function<String, OkHttpClient> provider = mock(Function.class);
        when(provider.apply("procurement")).thenReturn(new OkHttpClient());
        final var factory = OpenApiToolBoxFactory.httpClientProvidingBuilder()
                .okHttpClientProvider(provider)
                .objectMapper(JsonUtils.createMapper())
                .configuration(configuration())
                .build();
        assertTrue(factory.create("procurement").isPresent());
        verify(provider).apply("procurement");
        verifyNoMoreInteractions(provider);
    }

    @Test
    void testMissingHttpClient() {
        final var factory = OpenApiToolBoxFactory.httpClientProvidingBuilder()
                .okHttpClientProvider(server -> null)
                .objectMapper(JsonUtils.createMapper())
                .configuration(configuration())
                .build();
        assertThrows(NullPointerException.class, () -> factory.create("procurement"));
    }

    @Test
    void testNonNullGuards() {
        final var objectMapper = JsonUtils.createMapper();
        final var okHttpClient = mock(OkHttpClient.class);
        final var configuration = configuration();

        assertThrows(NullPointerException.class,
                     () -> OpenApiToolBoxFactory.builder()
                             .okHttpClient(null)
                             .objectMapper(objectMapper)
                             .configuration(configuration)
                             .build());
        assertThrows(NullPointerException.class,
                     () -> OpenApiToolBoxFactory.builder()
                             .okHttpClient(okHttpClient)
                             .objectMapper(null)
                             .configuration(configuration)
                             .build());
        assertThrows(NullPointerException.class,
                     () -> OpenApiToolBoxFactory.builder()
                             .okHttpClient(okHttpClient)
                             .objectMapper(objectMapper)
                             .configuration(null)
                             .build());
        assertThrows(NullPointerException.class,
                     () -> OpenApiToolBoxFactory.httpClientProvidingBuilder()
                             .okHttpClientProvider(null)
                             .objectMapper(objectMapper)
                             .configuration(configuration)
                             .build());
    }

    private static CatalogConfiguration configuration() {
        return CatalogConfiguration.builder()
                .servers(List.of(
                        ApiServerConfig.builder()
                                .name("procurement")
                                .openapi(OpenApiSourceConfig.builder()
                                                 .openapiFile(TestResources.path(TestResources.PROCUREMENT)
                                                                      .toString())
                                                 .baseUrl("http://localhost:8000")
                                                 .build())
                                .toolGeneration(ToolGenerationConfig.builder()
                                                        .includeAll(false)
                                                        .includeEndpoints(List.of("health"))
                                                        .toolPrefix("proc_")
                                                        .build())
                                .build(),
                        ApiServerConfig.builder()
                                .name("weather")
                                .type("external")
                                .build(),
                        ApiServerConfig.builder()
                                .name("archived")
                                .enabled(false)
                                .openapi(OpenApiSourceConfig.builder()
                                                 .openapiUrl("http://localhost:1/openapi.json")
                                                 .build())
                                .build()))
                .build();
    }
}
