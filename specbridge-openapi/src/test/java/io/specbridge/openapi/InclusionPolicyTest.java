package io.specbridge.openapi;

import io.specbridge.openapi.config.ToolGenerationConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link InclusionPolicy}
 */
class InclusionPolicyTest {

    @Test
    void testIncludeAll() {
        final var policy = InclusionPolicy.includeAll();
        assertTrue(policy.includes("listSuppliers", "/suppliers"));
        assertTrue(policy.includes(null, "/health"));
    }

    @Test
    void testAllowList() {
        final var policy = InclusionPolicy.builder()
                .includeAll(false)
                .include("listSuppliers")
                .include("/health")
                .build();
        assertTrue(policy.includes("listSuppliers", "/suppliers"));
        assertTrue(policy.includes(null, "/health"));
        assertFalse(policy.includes("createSupplier", "/suppliers"));
        assertFalse(policy.includes(null, "/orders"));
    }

    @Test
    void testDenyListWins() {
        final var policy = InclusionPolicy.builder()
                .includeAll(false)
                .include("listSuppliers")
                .exclude("/suppliers")
                .build();
        assertFalse(policy.includes("listSuppliers", "/suppliers"));
        assertFalse(InclusionPolicy.builder().exclude("health").build().includes("health", "/health"));
    }

    @Test
    void testFromConfig() {
        final var policy = InclusionPolicy.from(ToolGenerationConfig.builder()
                                                        .includeAll(false)
                                                        .includeEndpoints(List.of("/orders"))
                                                        .build());
        assertTrue(policy.includes("createOrder", "/orders"));
        assertFalse(policy.includes("listSuppliers", "/suppliers"));
        assertTrue(InclusionPolicy.from(ToolGenerationConfig.defaults()).includes(null, "/anything"));
    }
}
