package jsonrpc.wire;

import com.fasterxml.jackson.databind.JsonNode;
import jsonrpc.codec.MessageCodec;
import jsonrpc.messaging.Request;
import jsonrpc.messaging.Response;

import java.util.Objects;

/**
 * Binds a codec, a wire format, a method schema and a result type into the single
 * capability that clients and servers are built from. Holds no mutable state.
 *
 * @param <M> the method union type
 * @param <R> the result type
 */
public final class RpcBinding<M, R> {

    private final MessageCodec codec;
    private final WireFormat wireFormat;
    private final MethodSchema<M> schema;
    private final Class<R> resultType;

    public RpcBinding(MessageCodec codec, WireFormat wireFormat, MethodSchema<M> schema, Class<R> resultType) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.wireFormat = Objects.requireNonNull(wireFormat, "wireFormat");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.resultType = Objects.requireNonNull(resultType, "resultType");
    }

    public MessageCodec codec() { return codec; }
    public WireFormat wireFormat() { return wireFormat; }
    public MethodSchema<M> schema() { return schema; }
    public Class<R> resultType() { return resultType; }

    /**
     * @throws jsonrpc.codec.PackException if the request cannot be encoded
     */
    public byte[] encodeRequest(Request<M> request) {
        return codec.pack(wireFormat.writeRequest(request, schema));
    }

    /**
     * @throws jsonrpc.codec.UnpackException if the payload is not a valid request
     */
    public Request<M> decodeRequest(byte[] payload) {
        return wireFormat.readRequest(codec.unpack(payload, JsonNode.class), schema);
    }

    /**
     * @throws jsonrpc.codec.PackException if the response cannot be encoded
     */
    public byte[] encodeResponse(Response<R> response) {
        return codec.pack(wireFormat.writeResponse(response));
    }

    /**
     * @throws jsonrpc.codec.UnpackException if the payload is not a valid response
     */
    public Response<R> decodeResponse(byte[] payload) {
        return wireFormat.readResponse(codec.unpack(payload, JsonNode.class), resultType);
    }

    /**
     * @throws jsonrpc.codec.UnpackException if not even the identifier can be read
     */
    public RecoveredRequest decodeRecoverable(byte[] payload) {
        return wireFormat.readRecoverable(codec.unpack(payload, JsonNode.class));
    }

    @Override
    public String toString() {
        return "RpcBinding{" + codec.formatName() + ", " + wireFormat.mode() + ", " + wireFormat.profile()
                + ", " + schema + ", result=" + resultType.getSimpleName() + "}";
    }
}
