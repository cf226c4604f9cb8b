package jsonrpc.server;

import jsonrpc.codec.PackException;
import jsonrpc.codec.UnpackException;
import jsonrpc.messaging.Outcome;
import jsonrpc.messaging.Request;
import jsonrpc.messaging.Response;
import jsonrpc.messaging.RpcError;
import jsonrpc.messaging.RpcErrorKind;
import jsonrpc.messaging.RpcException;
import jsonrpc.wire.RecoveredRequest;
import jsonrpc.wire.RpcBinding;
import jsonrpc.wire.TextStorage;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dispatches inbound payloads to an {@link RpcHandler} and encodes the answers.
 * <p>
 * Each payload is handled independently: decode, invoke, encode. A payload that does
 * not decode as a request is answered with an error when an identifier can still be
 * read from it, and silently dropped otherwise. Calls without an identifier never
 * produce output. The server holds no mutable state and may be called from several
 * threads at once.
 *
 * @param <M> the method union type
 * @param <R> the result type
 * @param <S> the source descriptor type
 */
public final class RpcServer<M, R, S> {

    static final String ERR_FAILED_TO_PARSE = "Failed to parse RPC request";

    private static final Logger logger = Logger.getLogger(RpcServer.class.getName());

    private final RpcBinding<M, R> binding;
    private final RpcHandler<M, R, S> handler;
    private final TextStorage textStorage;

    public RpcServer(RpcBinding<M, R> binding, RpcHandler<M, R, S> handler) {
        this.binding = Objects.requireNonNull(binding, "binding");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.textStorage = binding.wireFormat().profile().textStorage();
    }

    public RpcBinding<M, R> getBinding() {
        return binding;
    }

    /**
     * Invokes the handler for an already decoded request.
     *
     * @return the response, or empty if the request has no identifier
     */
    public Optional<Response<R>> handleRequest(Request<M> request, S source) {
        Objects.requireNonNull(request, "request");
        Outcome<R> outcome = invoke(request.method(), source);
        if (!request.expectsResponse()) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Dropping " + (outcome.isSuccess() ? "result" : "error")
                        + " of fire-and-forget call from " + source);
            }
            return Optional.empty();
        }
        return Optional.of(Response.fromOutcome(request.id(), outcome));
    }

    /**
     * Decodes, dispatches and answers one inbound payload.
     *
     * @return the encoded response, or empty when nothing is to be sent back
     */
    public Optional<byte[]> handlePayload(byte[] payload, S source) {
        Request<M> request;
        try {
            request = binding.decodeRequest(payload);
        } catch (UnpackException e) {
            logger.warning(ERR_FAILED_TO_PARSE + " from " + source + ": " + e.getMessage());
            return recover(payload, e.getMessage());
        }
        return handleRequest(request, source).flatMap(this::encodeWithFallback);
    }

    private Outcome<R> invoke(M method, S source) {
        try {
            return Outcome.success(handler.handle(method, source));
        } catch (RpcException e) {
            RpcError error = e.getError();
            return Outcome.failure(RpcError.of(error.kind(), textStorage.fit(error.message())));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Handler failed on call from " + source, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            return Outcome.failure(RpcError.of(RpcErrorKind.INTERNAL_ERROR, textStorage.fit(message)));
        }
    }

    private Optional<byte[]> recover(byte[] payload, String decodeError) {
        RecoveredRequest recovered;
        try {
            recovered = binding.decodeRecoverable(payload);
        } catch (UnpackException e) {
            return Optional.empty();
        }
        Optional<Response<R>> response = recovered.toResponse(textStorage.fit(decodeError));
        return response.flatMap(this::encodeWithFallback);
    }

    /**
     * Encodes a response; if that fails, encodes an internal error with the same
     * identifier instead. Empty only if the substitute cannot be encoded either.
     */
    Optional<byte[]> encodeWithFallback(Response<R> response) {
        try {
            return Optional.of(binding.encodeResponse(response));
        } catch (PackException e) {
            logger.warning("Failed to serialize response " + response.id() + ": " + e.getMessage());
            try {
                return Optional.of(binding.encodeResponse(response.toInternalErrorResponse(textStorage.fit(e.getMessage()))));
            } catch (PackException fallbackFailure) {
                logger.log(Level.SEVERE, "Failed to serialize fallback error response " + response.id()
                        + ", no reply will be sent", fallbackFailure);
                return Optional.empty();
            }
        }
    }
}
