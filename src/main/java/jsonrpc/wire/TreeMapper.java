package jsonrpc.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import jsonrpc.codec.PackException;
import jsonrpc.codec.UnpackException;

/**
 * Converts application values (method parameters, results) to and from the Jackson
 * tree model that wire formats assemble envelopes from. The tree is independent of
 * the byte-level data format.
 */
final class TreeMapper {

    static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    // Parameterless method variants are empty records.
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    private TreeMapper() {}

    static JsonNode toTree(Object value) {
        try {
            return MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause instanceof JsonProcessingException
                    ? ((JsonProcessingException) cause).getOriginalMessage()
                    : cause.getMessage();
            throw new PackException("Failed to encode " + value.getClass().getSimpleName() + ": " + message, e);
        }
    }

    static <T> T fromTree(JsonNode node, Class<T> type) {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new UnpackException("Failed to decode " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new UnpackException("Failed to decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
