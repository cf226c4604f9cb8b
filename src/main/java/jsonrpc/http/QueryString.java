package jsonrpc.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linecorp.armeria.common.QueryParams;
import com.linecorp.armeria.common.QueryParamsBuilder;
import jsonrpc.codec.CodecException;
import jsonrpc.codec.JsonMessageCodec;
import jsonrpc.messaging.Id;
import jsonrpc.messaging.Request;
import jsonrpc.wire.MethodSchema;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Query-string view of a request: {@code i=1&m=hello&name=world}.
 * <p>
 * The identifier, if any, comes first as JSON text, then the method tag, then one pair
 * per parameter. Only scalar parameter values are supported. On decode, values are
 * typed by inspection: {@code true}, {@code false} and {@code null}, then unsigned,
 * signed and floating point numbers, and strings for everything else.
 */
public final class QueryString {

    public static final String ID_KEY = "i";
    public static final String METHOD_KEY = "m";

    private static final ObjectMapper MAPPER = JsonMessageCodec.createConfiguredObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final QueryParams params;

    public QueryString(QueryParams params) {
        this.params = Objects.requireNonNull(params, "params");
    }

    /**
     * Parses a form-encoded query string, without the leading {@code '?'}.
     */
    public QueryString(String value) {
        this(QueryParams.fromQueryString(Objects.requireNonNull(value, "value")));
    }

    /** The decoded pairs in their original order. */
    public QueryParams params() {
        return params;
    }

    /**
     * Encodes a request.
     *
     * @throws HttpConversionException if a parameter is not a scalar or the method cannot be encoded
     */
    public static <M> QueryString fromRequest(Request<M> request, MethodSchema<M> schema) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(schema, "schema");
        QueryParamsBuilder builder = QueryParams.builder();
        if (request.id() != null) {
            builder.add(ID_KEY, idToJson(request.id()));
        }
        ObjectNode methodParams;
        try {
            builder.add(METHOD_KEY, schema.tagOf(request.method()));
            methodParams = schema.paramsOf(request.method());
        } catch (CodecException e) {
            throw HttpConversionException.packError(e.getMessage(), e);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = methodParams.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.add(field.getKey(), scalarToString(field.getKey(), field.getValue()));
        }
        return new QueryString(builder.build());
    }

    /**
     * Decodes this query string into a request.
     *
     * @throws HttpConversionException if the method tag is missing, the identifier is not
     *         valid JSON, or the parameters do not match the method
     */
    public <M> Request<M> toRequest(MethodSchema<M> schema) {
        Objects.requireNonNull(schema, "schema");
        Id id = null;
        String tag = null;
        Map<String, JsonNode> methodParams = new TreeMap<>();
        int index = 0;
        for (Map.Entry<String, String> pair : params) {
            String name = pair.getKey();
            String raw = pair.getValue();
            if (ID_KEY.equals(name) && index == 0) {
                id = idFromJson(raw);
            } else if (METHOD_KEY.equals(name) && tag == null) {
                tag = raw;
            } else {
                methodParams.put(name, parseScalar(raw));
            }
            index++;
        }
        if (tag == null) {
            throw HttpConversionException.invalidData("the method is missing");
        }
        ObjectNode paramsNode = NODES.objectNode();
        paramsNode.setAll(methodParams);
        M method;
        try {
            method = schema.decode(tag, paramsNode);
        } catch (CodecException e) {
            throw HttpConversionException.packError(e.getMessage(), e);
        }
        return Request.fromParts(id, method);
    }

    /**
     * Types a raw value by inspection.
     */
    static JsonNode parseScalar(String s) {
        switch (s) {
            case "true":
                return NODES.booleanNode(true);
            case "false":
                return NODES.booleanNode(false);
            case "null":
                return NODES.nullNode();
            default:
                break;
        }
        try {
            long unsigned = Long.parseUnsignedLong(s);
            return unsigned >= 0 ? NODES.numberNode(unsigned)
                    : NODES.numberNode(new BigInteger(Long.toUnsignedString(unsigned)));
        } catch (NumberFormatException ignored) {
            // not unsigned, try signed next
        }
        try {
            return NODES.numberNode(Long.parseLong(s));
        } catch (NumberFormatException ignored) {
            // not signed either
        }
        if (DECIMAL.matcher(s).matches()) {
            double d = Double.parseDouble(s);
            if (Double.isFinite(d)) {
                return NODES.numberNode(d);
            }
        }
        return NODES.textNode(s);
    }

    static String scalarToString(String field, JsonNode value) {
        if (value.isNull()) {
            return "null";
        }
        if (value.isBoolean() || value.isNumber()) {
            return value.asText();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        throw HttpConversionException.invalidData("unsupported value type for field '" + field + "'");
    }

    private static String idToJson(Id id) {
        try {
            return MAPPER.writeValueAsString(id.value());
        } catch (JsonProcessingException e) {
            throw HttpConversionException.packError(e.getOriginalMessage(), e);
        }
    }

    private static Id idFromJson(String raw) {
        JsonNode node;
        try {
            node = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            throw HttpConversionException.packError(e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return Id.of(node.textValue());
        }
        if (node.isIntegralNumber()) {
            return Id.of(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return Id.of(node.doubleValue());
        }
        throw HttpConversionException.invalidData("the id must be a string or a number");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryString)) return false;
        return toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        return params.toQueryString();
    }
}
