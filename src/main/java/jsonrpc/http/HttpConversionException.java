package jsonrpc.http;

/**
 * Indicates that an envelope could not be converted to or from an HTTP-level view.
 */
public final class HttpConversionException extends RuntimeException {

    public HttpConversionException(String message) {
        super(message);
    }

    public HttpConversionException(String message, Throwable cause) {
        super(message, cause);
    }

    static HttpConversionException invalidData(String detail) {
        return new HttpConversionException("invalid data: " + detail);
    }

    static HttpConversionException packError(String detail, Throwable cause) {
        return new HttpConversionException("pack error: " + detail, cause);
    }
}
