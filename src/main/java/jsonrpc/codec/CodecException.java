package jsonrpc.codec;

/**
 * Base class of codec failures. Only the message is meaningful to callers; the cause is
 * kept for diagnostics.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
