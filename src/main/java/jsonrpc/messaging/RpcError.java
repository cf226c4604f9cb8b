package jsonrpc.messaging;

import java.util.Objects;
import java.util.Optional;

/**
 * An RPC error as carried in the error branch of a response: a kind and an optional
 * human-readable message.
 */
public record RpcError(RpcErrorKind kind, String message) {

    public RpcError {
        Objects.requireNonNull(kind, "Error kind cannot be null");
        // message can be null
    }

    /** Creates an error with no message. */
    public static RpcError of(RpcErrorKind kind) {
        return new RpcError(kind, null);
    }

    public static RpcError of(RpcErrorKind kind, String message) {
        return new RpcError(kind, message);
    }

    public Optional<String> messageIfPresent() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return message != null ? message + " (" + kind + ")" : kind.toString();
    }
}
