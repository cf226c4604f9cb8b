package jsonrpc.wire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jsonrpc.codec.UnpackException;
import jsonrpc.messaging.Id;
import jsonrpc.messaging.Outcome;
import jsonrpc.messaging.RpcError;
import jsonrpc.messaging.RpcErrorKind;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Field-level building blocks shared by the wire formats: identifiers, version marker,
 * error objects and results. Envelope layout is left to the subclasses.
 */
abstract class AbstractWireFormat implements WireFormat {

    static final String CODE_FIELD = "code";
    static final String MESSAGE_FIELD = "message";

    private final Profile profile;

    AbstractWireFormat(Profile profile) {
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    @Override
    public Profile profile() {
        return profile;
    }

    // ===== Envelope structure ===============================================

    static ObjectNode requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new UnpackException("invalid type: expected " + what + " object, found "
                    + (node == null ? "nothing" : node.getNodeType().name().toLowerCase(Locale.ROOT)));
        }
        return (ObjectNode) node;
    }

    static void rejectUnknownFields(ObjectNode node, Set<String> allowed) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw new UnpackException("unknown field `" + name + "`, expected one of " + allowed);
            }
        }
    }

    /**
     * Returns the value stored under {@code name} or its alias; null if neither is present.
     */
    static JsonNode field(ObjectNode node, String name, String alias) {
        JsonNode value = node.get(name);
        JsonNode aliased = alias != null ? node.get(alias) : null;
        if (value != null && aliased != null) {
            throw new UnpackException("duplicate field `" + name + "`");
        }
        return value != null ? value : aliased;
    }

    static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    // ===== Version marker ===================================================

    /**
     * Reads the version marker; null when absent or JSON null.
     */
    static String readVersion(ObjectNode node) {
        JsonNode value = node.get(VERSION_FIELD);
        if (isAbsent(value)) {
            return null;
        }
        if (!value.isTextual()) {
            throw new UnpackException("invalid type for `" + VERSION_FIELD + "`: expected a string");
        }
        return value.textValue();
    }

    // ===== Identifier =======================================================

    JsonNode writeId(Id id) {
        Object value = id.value();
        if (value instanceof Long) {
            return TreeMapper.NODES.numberNode((Long) value);
        }
        if (value instanceof BigInteger) {
            return TreeMapper.NODES.numberNode((BigInteger) value);
        }
        if (value instanceof Double) {
            return TreeMapper.NODES.numberNode((Double) value);
        }
        return TreeMapper.NODES.textNode((String) value);
    }

    /**
     * Reads an identifier; JSON null counts as absent.
     */
    Id readId(JsonNode value) {
        if (isAbsent(value)) {
            return null;
        }
        Id id;
        if (value.isTextual()) {
            id = Id.of(readText(value.textValue(), "id"));
        } else if (value.isIntegralNumber()) {
            id = Id.of(value.bigIntegerValue());
        } else if (value.isNumber() && Double.isFinite(value.doubleValue())) {
            id = Id.of(value.doubleValue());
        } else {
            throw new UnpackException("invalid type for `id`: expected a string or a number");
        }
        if (!profile.accepts(id)) {
            throw new UnpackException("invalid value for `id`: " + id + " is not accepted by the "
                    + profile + " profile");
        }
        return id;
    }

    String readText(String text, String field) {
        try {
            return profile.textStorage().admit(text);
        } catch (IllegalArgumentException e) {
            throw new UnpackException("invalid length for `" + field + "`: " + e.getMessage(), e);
        }
    }

    // ===== Outcome ==========================================================

    static ObjectNode writeError(RpcError error) {
        ObjectNode node = TreeMapper.NODES.objectNode();
        node.put(CODE_FIELD, error.kind().code());
        if (error.message() != null) {
            node.put(MESSAGE_FIELD, error.message());
        }
        return node;
    }

    /**
     * Reads an error object. Members other than code and message are ignored.
     */
    RpcError readError(JsonNode value) {
        ObjectNode node = requireObject(value, "error");
        JsonNode code = node.get(CODE_FIELD);
        if (code == null) {
            throw new UnpackException("missing field `" + CODE_FIELD + "`");
        }
        if (!code.isIntegralNumber() || !code.canConvertToLong()) {
            throw new UnpackException("invalid type for `" + CODE_FIELD + "`: expected i16");
        }
        RpcErrorKind kind;
        try {
            kind = RpcErrorKind.fromWire(code.longValue());
        } catch (IllegalArgumentException e) {
            throw new UnpackException("invalid value for `" + CODE_FIELD + "`: " + e.getMessage(), e);
        }
        JsonNode message = node.get(MESSAGE_FIELD);
        if (isAbsent(message)) {
            return RpcError.of(kind);
        }
        if (!message.isTextual()) {
            throw new UnpackException("invalid type for `" + MESSAGE_FIELD + "`: expected a string");
        }
        return RpcError.of(kind, readText(message.textValue(), MESSAGE_FIELD));
    }

    static JsonNode writeResult(Object result) {
        return result == null ? TreeMapper.NODES.nullNode() : TreeMapper.toTree(result);
    }

    static <R> R readResult(JsonNode value, Class<R> resultType) {
        return TreeMapper.fromTree(value, resultType);
    }

    /**
     * Reads an outcome stored under one of two field pairs. Exactly one must be present.
     */
    <R> Outcome<R> readOutcome(ObjectNode node, Class<R> resultType,
                               String resultField, String resultAlias,
                               String errorField, String errorAlias) {
        JsonNode result = field(node, resultField, resultAlias);
        JsonNode error = field(node, errorField, errorAlias);
        if (result != null && error != null) {
            throw new UnpackException("response carries both `" + resultField + "` and `" + errorField + "`");
        }
        if (error != null) {
            return Outcome.failure(readError(error));
        }
        if (result != null) {
            return Outcome.success(readResult(result, resultType));
        }
        throw new UnpackException("response carries neither `" + resultField + "` nor `" + errorField + "`");
    }

    static void putOutcome(ObjectNode node, Outcome<?> outcome, String resultField, String errorField) {
        if (outcome instanceof Outcome.Success<?> success) {
            node.set(resultField, writeResult(success.result()));
        } else {
            node.set(errorField, writeError(((Outcome.Failure<?>) outcome).rpcError()));
        }
    }

    // ===== Method ===========================================================

    String readTag(JsonNode value, String field) {
        if (value == null) {
            throw new UnpackException("missing field `" + field + "`");
        }
        if (!value.isTextual()) {
            throw new UnpackException("invalid type for `" + field + "`: expected a string");
        }
        return readText(value.textValue(), field);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + profile + "}";
    }
}
