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
 * Space-reduced, non-standard envelopes:
 *
 * <pre>
 * {"i":1,"m":"hello","p":{"name":"world"}}
 * {"i":1,"r":"Hello, world"}
 * {"i":1,"e":{"code":-32601,"message":"..."}}
 * </pre>
 *
 * No version marker is written. A marker sent by a canonical peer is tolerated with any
 * value.
 */
public final class CompactWireFormat extends AbstractWireFormat {

    static final String ID = "i";
    static final String METHOD = "m";
    static final String PARAMS = "p";
    static final String RESULT = "r";
    static final String ERROR = "e";

    private static final Set<String> REQUEST_FIELDS = Set.of(VERSION_FIELD, ID, METHOD, PARAMS);
    private static final Set<String> RESPONSE_FIELDS = Set.of(VERSION_FIELD, ID, RESULT, ERROR);

    public CompactWireFormat(Profile profile) {
        super(profile);
    }

    public CompactWireFormat() {
        this(Profile.STANDARD);
    }

    @Override
    public WireMode mode() {
        return WireMode.COMPACT;
    }

    @Override
    public <M> ObjectNode writeRequest(Request<M> request, MethodSchema<M> schema) {
        ObjectNode node = TreeMapper.NODES.objectNode();
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
        readVersion(node);
        Id id = readId(node.get(ID));
        String tag = readTag(node.get(METHOD), METHOD);
        M method = schema.decode(tag, node.get(PARAMS));
        return Request.fromParts(id, method);
    }

    @Override
    public <R> ObjectNode writeResponse(Response<R> response) {
        ObjectNode node = TreeMapper.NODES.objectNode();
        node.set(ID, writeId(response.id()));
        putOutcome(node, response.outcome(), RESULT, ERROR);
        return node;
    }

    @Override
    public <R> Response<R> readResponse(JsonNode tree, Class<R> resultType) {
        ObjectNode node = requireObject(tree, "response");
        rejectUnknownFields(node, RESPONSE_FIELDS);
        readVersion(node);
        Id id = readId(node.get(ID));
        if (id == null) {
            throw new UnpackException("missing field `" + ID + "`");
        }
        Outcome<R> outcome = readOutcome(node, resultType, RESULT, null, ERROR, null);
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
        Id id = readId(node.get(ID));
        return new RecoveredRequest(WireMode.COMPACT, version, id);
    }
}
