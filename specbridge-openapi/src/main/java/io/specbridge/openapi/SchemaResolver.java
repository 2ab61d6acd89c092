package io.specbridge.openapi;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.specbridge.core.errors.UnresolvedReferenceError;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;

/**
 * Dereferences internal <code>$ref</code> pointers (<code>#/components/schemas/X</code>) against a document.
 * <p>
 * In lenient mode an unresolvable pointer yields an empty schema object; in strict mode it raises
 * {@link UnresolvedReferenceError}.
 */
@Slf4j
public class SchemaResolver {
    public static final String REF = "$ref";

    private final JsonNode root;
    private final boolean strict;

    public SchemaResolver(@NonNull ApiDocument document, boolean strict) {
        this.root = document.getRoot();
        this.strict = strict;
    }

    /**
     * Resolves a single pointer by walking the document through each segment after the leading <code>#</code>.
     *
     * @param pointer Internal pointer, for example <code>#/components/schemas/Item</code>
     * @return The subtree the pointer designates (not a copy)
     */
    public JsonNode resolve(String pointer) {
        if (null == pointer || !pointer.startsWith("#")) {
            return unresolved(pointer, "only document-internal pointers are supported");
        }
        final JsonPointer path;
        try {
            path = JsonPointer.compile(pointer.substring(1));
        }
        catch (IllegalArgumentException e) {
            return unresolved(pointer, e.getMessage());
        }
        final var target = root.at(path);
        if (target.isMissingNode()) {
            return unresolved(pointer, "target does not exist");
        }
        return target;
    }

    /**
     * Resolves a schema whose top level may be a pointer, following chains of pointers
     *
     * @param schema A schema node, possibly <code>{"$ref": "..."}</code>
     * @return The schema itself if it is not a pointer, else the schema at the end of the chain
     */
    public JsonNode resolveSchema(JsonNode schema) {
        if (null == schema) {
            return null;
        }
        var current = schema;
        final var seen = new HashSet<String>();
        while (isReference(current)) {
            final var pointer = current.get(REF).asText();
            if (!seen.add(pointer)) {
                return unresolved(pointer, "circular reference");
            }
            current = resolve(pointer);
        }
        return current;
    }

    public static boolean isReference(JsonNode node) {
        return null != node && node.isObject() && node.hasNonNull(REF) && node.get(REF).isTextual();
    }

    private JsonNode unresolved(String pointer, String reason) {
        if (strict) {
            throw new UnresolvedReferenceError(pointer, reason);
        }
        log.debug("Could not resolve reference {} ({}). Using empty schema", pointer, reason);
        return JsonNodeFactory.instance.objectNode();
    }
}
