package jsonrpc.codec;

/**
 * Indicates that bytes could not be turned into a value of the requested shape, either
 * because they are not valid in the data format or because the decoded structure does
 * not match what was expected.
 */
public final class UnpackException extends CodecException {

    public UnpackException(String message) {
        super(message);
    }

    public UnpackException(String message, Throwable cause) {
        super(message, cause);
    }
}
