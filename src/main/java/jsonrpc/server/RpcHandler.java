package jsonrpc.server;

import jsonrpc.messaging.RpcException;

/**
 * Application logic behind an {@link RpcServer}.
 *
 * @param <M> the method union type
 * @param <R> the result type
 * @param <S> the source descriptor type, e.g. a peer address or connection tag
 */
@FunctionalInterface
public interface RpcHandler<M, R, S> {

    /**
     * Executes a decoded method.
     *
     * @param method the method with its parameters
     * @param source where the call came from, passed through untouched for logging or auditing
     * @return the result, which may be {@code null} for methods without one
     * @throws RpcException to answer with an error outcome
     */
    R handle(M method, S source);
}
