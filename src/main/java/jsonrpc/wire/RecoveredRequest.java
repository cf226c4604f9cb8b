package jsonrpc.wire;

import jsonrpc.messaging.Id;
import jsonrpc.messaging.Response;
import jsonrpc.messaging.RpcError;
import jsonrpc.messaging.RpcErrorKind;

import java.util.Objects;
import java.util.Optional;

/**
 * What could be salvaged from a payload that is not a valid request: the version marker
 * and identifier, if present. Used to tell the caller why its call was rejected.
 *
 * @param mode    the wire mode the payload was read under
 * @param version the version marker, or {@code null} if absent
 * @param id      the call identifier, or {@code null} if absent
 */
public record RecoveredRequest(WireMode mode, String version, Id id) {

    public RecoveredRequest {
        Objects.requireNonNull(mode, "mode");
    }

    /**
     * The error to answer with. In canonical mode a correct marker means the payload was
     * structurally a request with a bad method ({@code MethodNotFound}), a wrong marker is
     * a version mismatch and a missing marker means it was not a request at all (both
     * {@code InvalidRequest}). Compact mode has no marker to go by.
     *
     * @param decodeError message of the failed full decode
     */
    public RpcError error(String decodeError) {
        if (mode == WireMode.COMPACT) {
            return RpcError.of(RpcErrorKind.METHOD_NOT_FOUND, decodeError);
        }
        if (version == null) {
            return RpcError.of(RpcErrorKind.INVALID_REQUEST);
        }
        if (WireFormat.JSONRPC_VERSION.equals(version)) {
            return RpcError.of(RpcErrorKind.METHOD_NOT_FOUND, decodeError);
        }
        return RpcError.of(RpcErrorKind.INVALID_REQUEST, WireFormat.ERR_INVALID_PROTOCOL_VERSION);
    }

    /**
     * The error response, or empty when there is no identifier to answer to.
     */
    public <R> Optional<Response<R>> toResponse(String decodeError) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.of(Response.failure(id, error(decodeError)));
    }
}
