package io.github.vishalmysore.loggraph.ast;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.vishalmysore.loggraph.util.Checks;

/**
 * Canonical serialization of ASTs. The serialized form is used as an index
 * key by the graph and as the sort key when canonicalizing sets, so it only
 * has to be deterministic: equal ASTs always produce equal strings.
 *
 * Only fields are serialized, sorted by name, and unset fields are
 * omitted. A missing AST serializes as {@code "null"}.
 */
public final class AstSerializer {
    public static final String NULL_KEY = "null";

    private static final ObjectMapper mapper = JsonMapper.builder()
            .visibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
            .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private AstSerializer() {
    }

    public static String serialize(Ast ast) {
        if (ast == null) {
            return NULL_KEY;
        }
        try {
            return mapper.writeValueAsString(ast);
        } catch (JsonProcessingException e) {
            throw Checks.fail("Failed to serialize AST: " + e.getMessage());
        }
    }

    public static JsonNode toTree(Ast ast) {
        return mapper.valueToTree(ast);
    }
}
