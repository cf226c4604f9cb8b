package jsonrpc.messaging;

import java.util.Objects;
import java.util.Optional;

/**
 * A JSON-RPC request envelope around an application-defined method.
 * <p>
 * A request without an identifier is fire-and-forget: no response is ever produced
 * for it. The protocol version marker is not part of the value; wire formats that use
 * it write and check it themselves.
 *
 * @param id     the call identifier, or {@code null} for fire-and-forget
 * @param method the method variant with its parameters
 * @param <M>    the application's method union
 */
public record Request<M>(Id id, M method) {

    public Request {
        Objects.requireNonNull(method, "Method cannot be null");
        // id can be null for fire-and-forget calls
    }

    /** Creates a request that expects a response. */
    public static <M> Request<M> create(Id id, M method) {
        return new Request<>(Objects.requireNonNull(id, "Id cannot be null"), method);
    }

    /** Creates a request with no identifier; nobody will ever answer it. */
    public static <M> Request<M> fireAndForget(M method) {
        return new Request<>(null, method);
    }

    /** Combines separately (de)serialized parts into a request; {@code id} may be null. */
    public static <M> Request<M> fromParts(Id id, M method) {
        return new Request<>(id, method);
    }

    public Optional<Id> optionalId() {
        return Optional.ofNullable(id);
    }

    public boolean expectsResponse() {
        return id != null;
    }
}
