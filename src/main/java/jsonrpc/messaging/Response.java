package jsonrpc.messaging;

import java.util.Objects;

/**
 * A JSON-RPC response envelope: the identifier of the answered call and its outcome.
 *
 * @param <R> the result type
 */
public record Response<R>(Id id, Outcome<R> outcome) {

    public Response {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(outcome, "Outcome cannot be null");
    }

    public static <R> Response<R> fromOutcome(Id id, Outcome<R> outcome) {
        return new Response<>(id, outcome);
    }

    public static <R> Response<R> success(Id id, R result) {
        return new Response<>(id, Outcome.success(result));
    }

    public static <R> Response<R> failure(Id id, RpcError error) {
        return new Response<>(id, Outcome.failure(error));
    }

    /** Wraps {@code message} into an {@link RpcErrorKind#INTERNAL_ERROR} response. */
    public static <R> Response<R> fromInternalError(Id id, String message) {
        return failure(id, RpcError.of(RpcErrorKind.INTERNAL_ERROR, message));
    }

    /** Same call identifier, outcome replaced by the given error. */
    public Response<R> toErrorResponse(RpcError error) {
        return failure(id, error);
    }

    public Response<R> toInternalErrorResponse(String message) {
        return fromInternalError(id, message);
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }
}
