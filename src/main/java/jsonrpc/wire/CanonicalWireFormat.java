package jsonrpc.wire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jsonrpc.codec.UnpackException;
import jsonrpc.messaging.Id;
import jsonrpc.messaging.Outcome;
import jsonrpc.messaging.Request;
import jsonrpc.messaging.Response;

import java.util.Set;

/**
 * Strict JSON-RPC 2.0 envelopes:
 *
 * <pre>
 * {"jsonrpc":"2.0","id":1,"method":"hello","params":{"name":"world"}}
 * {"jsonrpc":"2.0","id":1,"result":"Hello, world"}
 * {"jsonrpc":"2.0","id":1,"error":{"code":-32601,"message":"..."}}
 * </pre>
 *
 * The version marker is always written and, when present on decode, must be
 * {@value WireFormat#JSONRPC_VERSION}. The compact names {@code i}, {@code r} and
 * {@code e} are accepted as aliases on decode.
 */
public final class CanonicalWireFormat extends AbstractWireFormat {

    static final String ID = "id";
    static final String ID_ALIAS = "i";
    static final String METHOD = "method";
    static final String PARAMS = "params";
    static final String RESULT = "result";
    static final String RESULT_ALIAS = "r";
    static final String ERROR = "error";
    static final String ERROR_ALIAS = "e";

    private static final Set<String> REQUEST_FIELDS = Set.of(VERSION_FIELD, ID, ID_ALIAS, METHOD, PARAMS);
    private static final Set<String> RESPONSE_FIELDS =
            Set.of(VERSION_FIELD, ID, ID_ALIAS, RESULT, RESULT_ALIAS, ERROR, ERROR_ALIAS);

    public CanonicalWireFormat(Profile profile) {
        super(profile);
    }

    public CanonicalWireFormat() {
        this(Profile.STANDARD);
    }

    @Override
    public WireMode mode() {
        return WireMode.CANONICAL;
    }

    @Override
    public <M> ObjectNode writeRequest(Request<M> request, MethodSchema<M> schema) {
        ObjectNode node = TreeMapper.NODES.objectNode();
        node.put(VERSION_FIELD, JSONRPC_VERSION);
        if (request.id() != null) {
            node.set(ID, writeId(request.id()));
        }
        node.put(METHOD, schema.tagOf(request.method()));
        node.set(PARAMS, schema.paramsOf(request.method()));
        return node;
    }

    @Override
    public <M> Request<M> readRequest(JsonNode tree, MethodSchema<M> schema) {
        ObjectNode node = requireObject(tree, "request");
        rejectUnknownFields(node, REQUEST_FIELDS);
        checkVersion(node);
        Id id = readId(field(node, ID, ID_ALIAS));
        String tag = readTag(node.get(METHOD), METHOD);
        M method = schema.decode(tag, node.get(PARAMS));
        return Request.fromParts(id, method);
    }

    @Override
    public <R> ObjectNode writeResponse(Response<R> response) {
        ObjectNode node = TreeMapper.NODES.objectNode();
        node.put(VERSION_FIELD, JSONRPC_VERSION);
        node.set(ID, writeId(response.id()));
        putOutcome(node, response.outcome(), RESULT, ERROR);
        return node;
    }

    @Override
    public <R> Response<R> readResponse(JsonNode tree, Class<R> resultType) {
        ObjectNode node = requireObject(tree, "response");
        rejectUnknownFields(node, RESPONSE_FIELDS);
        checkVersion(node);
        Id id = readId(field(node, ID, ID_ALIAS));
        if (id == null) {
            throw new UnpackException("missing field `" + ID + "`");
        }
        Outcome<R> outcome = readOutcome(node, resultType, RESULT, RESULT_ALIAS, ERROR, ERROR_ALIAS);
        return Response.fromOutcome(id, outcome);
    }

    @Override
    public <R> ObjectNode writeOutcome(Outcome<R> outcome) {
        ObjectNode node = TreeMapper.NODES.objectNode();
        putOutcome(node, outcome, RESULT, ERROR);
        return node;
    }

    @Override
    public RecoveredRequest readRecoverable(JsonNode tree) {
        ObjectNode node = requireObject(tree, "request");
        String version = readVersion(node);
        Id id = readId(field(node, ID, ID_ALIAS));
        return new RecoveredRequest(WireMode.CANONICAL, version, id);
    }

    private static void checkVersion(ObjectNode node) {
        String version = readVersion(node);
        if (version != null && !JSONRPC_VERSION.equals(version)) {
            throw new UnpackException(ERR_INVALID_PROTOCOL_VERSION);
        }
    }
}
