package jsonrpc.messaging;

import java.util.Objects;

/**
 * Unchecked carrier of an {@link RpcError}. Handlers throw it to answer with an error
 * outcome; the client throws it when a call resolves to an error.
 */
public class RpcException extends RuntimeException {

    private final RpcError error;

    public RpcException(RpcError error) {
        super(Objects.requireNonNull(error, "error").toString());
        this.error = error;
    }

    public RpcException(RpcErrorKind kind, String message) {
        this(RpcError.of(kind, message));
    }

    public RpcException(RpcErrorKind kind) {
        this(RpcError.of(kind));
    }

    public RpcError getError() {
        return error;
    }

    public RpcErrorKind getKind() {
        return error.kind();
    }
}
