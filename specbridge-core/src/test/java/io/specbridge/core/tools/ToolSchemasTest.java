package io.specbridge.core.tools;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specbridge.core.utils.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link ToolSchemas}
 */
class ToolSchemasTest {

    @Test
    void testHeaderParametersAreLeftOut() {
        final var arguments = ToolSchemas.arguments(ToolFixtures.getSupplier());
        assertEquals(List.of("supplier_id"), arguments.stream().map(ParameterSpec::getName).toList());
    }

    @Test
    void testInputSchemaForPathAndQuery() {
        final var mapper = JsonUtils.createMapper();
        final var schema = ToolSchemas.inputSchema(ToolFixtures.getSupplier(), mapper);
        assertEquals("object", schema.get("type").asText());
        assertEquals("integer", schema.at("/properties/supplier_id/type").asText());
        assertEquals("Supplier identifier", schema.at("/properties/supplier_id/description").asText());
        assertEquals("supplier_id", schema.get("required").get(0).asText());
        assertFalse(schema.get("properties").has("X-Request-Id"));

        final var listSchema = ToolSchemas.inputSchema(ToolFixtures.listSuppliers(), mapper);
        assertEquals(2, listSchema.at("/properties/status/enum").size());
        assertEquals("active", listSchema.at("/properties/status/default").asText());
        assertEquals("integer", listSchema.at("/properties/ids/items/type").asText());
        assertTrue(listSchema.get("required").isEmpty());
    }

    @Test
    void testInputSchemaForBody() {
        final var schema = ToolSchemas.inputSchema(ToolFixtures.createOrder(), JsonUtils.createMapper());
        assertEquals("string", schema.at("/properties/supplier_name/type").asText());
        assertEquals("integer", schema.at("/properties/quantity/type").asText());
        assertEquals(1, schema.get("required").size());
        assertEquals("supplier_name", schema.get("required").get(0).asText());
    }

    @Test
    void testInputSchemaIsDetachedFromTool() {
        final var mapper = JsonUtils.createMapper();
        final var tool = ToolFixtures.listSuppliers();
        final var schema = ToolSchemas.inputSchema(tool, mapper);
        ((ObjectNode) schema.at("/properties/ids/items")).put("type", "string");
        ((ArrayNode) schema.at("/properties/status/enum")).add("deleted");

        final var fresh = ToolSchemas.inputSchema(tool, mapper);
        assertEquals("integer", fresh.at("/properties/ids/items/type").asText());
        assertEquals(2, fresh.at("/properties/status/enum").size());
    }

    @Test
    void testNoArguments() {
        final var schema = ToolSchemas.inputSchema(ToolFixtures.health(), JsonUtils.createMapper());
        assertTrue(schema.get("properties").isEmpty());
        assertTrue(schema.get("required").isEmpty());
    }
}
