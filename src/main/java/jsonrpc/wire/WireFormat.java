package jsonrpc.wire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jsonrpc.messaging.Outcome;
import jsonrpc.messaging.Request;
import jsonrpc.messaging.Response;

/**
 * Maps envelopes to and from the Jackson tree model under one tagging scheme.
 * <p>
 * The byte-level data format is a separate concern handled by a
 * {@link jsonrpc.codec.MessageCodec}; a wire format only decides field names, presence
 * rules and the version marker. Implementations are stateless and thread-safe.
 */
public interface WireFormat {

    /** The fixed JSON-RPC protocol version. */
    String JSONRPC_VERSION = "2.0";

    /** Name of the version marker field. */
    String VERSION_FIELD = "jsonrpc";

    String ERR_INVALID_PROTOCOL_VERSION = "Invalid protocol version";

    WireMode mode();

    Profile profile();

    /**
     * @throws jsonrpc.codec.PackException if the method cannot be encoded
     */
    <M> ObjectNode writeRequest(Request<M> request, MethodSchema<M> schema);

    /**
     * @throws jsonrpc.codec.UnpackException if the tree is not a valid request
     */
    <M> Request<M> readRequest(JsonNode node, MethodSchema<M> schema);

    /**
     * @throws jsonrpc.codec.PackException if the result cannot be encoded
     */
    <R> ObjectNode writeResponse(Response<R> response);

    /**
     * @throws jsonrpc.codec.UnpackException if the tree is not a valid response
     */
    <R> Response<R> readResponse(JsonNode node, Class<R> resultType);

    /**
     * Encodes the outcome alone, as the single-field object it occupies inside a response.
     */
    <R> ObjectNode writeOutcome(Outcome<R> outcome);

    /**
     * Minimal decode of a payload that failed to parse as a request: extracts only the
     * version marker and the identifier, ignoring everything else.
     *
     * @throws jsonrpc.codec.UnpackException if even these fields are unreadable
     */
    RecoveredRequest readRecoverable(JsonNode node);
}
