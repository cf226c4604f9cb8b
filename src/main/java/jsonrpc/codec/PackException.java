package jsonrpc.codec;

/**
 * Indicates that a value could not be turned into bytes.
 */
public final class PackException extends CodecException {

    public PackException(String message) {
        super(message);
    }

    public PackException(String message, Throwable cause) {
        super(message, cause);
    }
}
