package jsonrpc.client;

import jsonrpc.messaging.Id;
import jsonrpc.messaging.Request;
import jsonrpc.wire.RpcBinding;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds encoded requests and hands back {@link PendingCall}s that match the eventual
 * response to the call.
 * <p>
 * Call identifiers come from a 32-bit counter starting at zero, read as unsigned and
 * wrapping after 4294967295. The counter is the client's only state; it is safe to
 * issue calls from several threads at once and no two concurrent calls share an
 * identifier until the counter wraps. The client keeps no record of outstanding calls,
 * and timeouts and retries are up to the transport.
 *
 * @param <M> the method union type
 * @param <R> the result type
 */
public final class RpcClient<M, R> {

    private final RpcBinding<M, R> binding;
    private final AtomicInteger requestIdGenerator;

    public RpcClient(RpcBinding<M, R> binding) {
        this(binding, 0);
    }

    /** Starts the counter at {@code initialCounter}, read as unsigned. */
    RpcClient(RpcBinding<M, R> binding, int initialCounter) {
        this.binding = Objects.requireNonNull(binding, "binding");
        this.requestIdGenerator = new AtomicInteger(initialCounter);
    }

    public RpcBinding<M, R> getBinding() {
        return binding;
    }

    /**
     * Allocates the next identifier and encodes a request expecting a response.
     *
     * @throws jsonrpc.codec.PackException if the request cannot be encoded
     */
    public PendingCall<R> request(M method) {
        Id id = Id.ofUnsigned(requestIdGenerator.getAndIncrement());
        byte[] payload = binding.encodeRequest(Request.create(id, method));
        return new PendingCall<>(binding, id, payload);
    }

    /**
     * Encodes a request without an identifier. No identifier is allocated and no
     * response will ever arrive for it.
     *
     * @throws jsonrpc.codec.PackException if the request cannot be encoded
     */
    public PendingCall<R> requestFireAndForget(M method) {
        byte[] payload = binding.encodeRequest(Request.fireAndForget(method));
        return new PendingCall<>(binding, null, payload);
    }
}
