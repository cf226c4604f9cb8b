package jsonrpc.messaging;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The result carried by a response: either a success value or an {@link RpcError},
 * never both and never neither.
 *
 * @param <R> the result type
 */
public sealed interface Outcome<R> permits Outcome.Success, Outcome.Failure {

    static <R> Outcome<R> success(R value) {
        return new Success<>(value);
    }

    static <R> Outcome<R> failure(RpcError error) {
        return new Failure<>(error);
    }

    /**
     * Runs the supplier and captures its value, or the error of a thrown
     * {@link RpcException}. Other exceptions propagate.
     */
    static <R> Outcome<R> of(Supplier<R> supplier) {
        try {
            return success(supplier.get());
        } catch (RpcException e) {
            return failure(e.getError());
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    Optional<R> value();

    Optional<RpcError> error();

    /**
     * Unwraps the outcome into the ordinary result.
     *
     * @throws RpcException carrying the error of a failed outcome
     */
    R toResult();

    /** Successful outcome; the value may be {@code null} for methods without a result. */
    record Success<R>(R result) implements Outcome<R> {
        @Override public boolean isSuccess() { return true; }
        @Override public Optional<R> value() { return Optional.ofNullable(result); }
        @Override public Optional<RpcError> error() { return Optional.empty(); }
        @Override public R toResult() { return result; }
    }

    record Failure<R>(RpcError rpcError) implements Outcome<R> {
        public Failure {
            Objects.requireNonNull(rpcError, "Error cannot be null");
        }

        @Override public boolean isSuccess() { return false; }
        @Override public Optional<R> value() { return Optional.empty(); }
        @Override public Optional<RpcError> error() { return Optional.of(rpcError); }
        @Override public R toResult() { throw new RpcException(rpcError); }
    }
}
