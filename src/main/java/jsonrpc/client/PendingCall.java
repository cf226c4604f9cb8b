package jsonrpc.client;

import jsonrpc.codec.UnpackException;
import jsonrpc.messaging.Id;
import jsonrpc.messaging.Response;
import jsonrpc.messaging.RpcErrorKind;
import jsonrpc.messaging.RpcException;
import jsonrpc.wire.RpcBinding;

import java.util.Objects;
import java.util.Optional;

/**
 * A single encoded call and the means to resolve it. Instances are handed out by
 * {@link RpcClient} and are meant for one owner; they are not thread-safe.
 *
 * @param <R> the result type
 */
public final class PendingCall<R> {

    static final String ERR_ID_MISSING = "request id is missing";
    static final String ERR_ID_MISMATCH = "response id does not match request id";

    private static final byte[] EMPTY = new byte[0];

    private final RpcBinding<?, R> binding;
    private final Id id;
    private byte[] payload;

    PendingCall(RpcBinding<?, R> binding, Id id, byte[] payload) {
        this.binding = Objects.requireNonNull(binding, "binding");
        this.id = id;
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    /** The call identifier; empty for fire-and-forget calls. */
    public Optional<Id> id() {
        return Optional.ofNullable(id);
    }

    public boolean expectsResponse() {
        return id != null;
    }

    /** A copy of the encoded request; empty once {@link #takePayload()} was called. */
    public byte[] payload() {
        return payload.clone();
    }

    /** Hands the encoded request over to the caller, leaving this call with an empty payload. */
    public byte[] takePayload() {
        byte[] taken = payload;
        payload = EMPTY;
        return taken;
    }

    /**
     * Decodes a response payload and resolves this call with it.
     *
     * @return the result of a successful call
     * @throws RpcException with {@code InvalidRequest} for a fire-and-forget call or a
     *         response to a different call, {@code ParseError} if the payload is not a
     *         valid response, or the error the server answered with
     */
    public R handleResponse(byte[] responsePayload) {
        if (id == null) {
            throw new RpcException(RpcErrorKind.INVALID_REQUEST, ERR_ID_MISSING);
        }
        Response<R> response;
        try {
            response = binding.decodeResponse(responsePayload);
        } catch (UnpackException e) {
            throw new RpcException(RpcErrorKind.PARSE_ERROR, e.getMessage());
        }
        if (!id.equals(response.id())) {
            throw new RpcException(RpcErrorKind.INVALID_REQUEST, ERR_ID_MISMATCH);
        }
        return response.outcome().toResult();
    }

    @Override
    public String toString() {
        return "PendingCall{id=" + id + ", payloadSize=" + payload.length + "}";
    }
}
