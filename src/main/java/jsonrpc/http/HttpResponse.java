package jsonrpc.http;

import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.ResponseHeaders;
import jsonrpc.codec.CodecException;
import jsonrpc.codec.JsonMessageCodec;
import jsonrpc.codec.MessageCodec;
import jsonrpc.messaging.Id;
import jsonrpc.messaging.Response;
import jsonrpc.wire.WireFormat;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * HTTP view of a response. The status tells success from failure, the identifier travels
 * in the {@value #ID_HEADER} header and the body holds only the outcome, as JSON.
 */
public final class HttpResponse {

    public static final String ID_HEADER = "X-JSONRPC-ID";

    private static final MessageCodec BODY_CODEC = new JsonMessageCodec();

    private final ResponseHeaders headers;
    private final byte[] body;

    private HttpResponse(ResponseHeaders headers, byte[] body) {
        this.headers = headers;
        this.body = body;
    }

    /**
     * Builds the HTTP view of a response, laying out the outcome with the given wire format.
     *
     * @throws HttpConversionException if the identifier cannot be carried in a header
     *         or the outcome cannot be encoded
     */
    public static <R> HttpResponse fromResponse(Response<R> response, WireFormat wireFormat) {
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(wireFormat, "wireFormat");
        byte[] body;
        String idText;
        try {
            body = BODY_CODEC.pack(wireFormat.writeOutcome(response.outcome()));
            idText = idText(response.id());
        } catch (CodecException e) {
            throw HttpConversionException.packError(e.getMessage(), e);
        }
        HttpStatus status = response.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        ResponseHeaders headers;
        try {
            headers = ResponseHeaders.builder(status)
                                     .contentType(MediaType.JSON)
                                     .add(ID_HEADER, idText)
                                     .build();
        } catch (IllegalArgumentException e) {
            throw new HttpConversionException("invalid data: failed to parse id as http header", e);
        }
        return new HttpResponse(headers, body);
    }

    /**
     * Strings as-is; numbers exactly as the JSON body writes them.
     */
    static String idText(Id id) {
        if (id.isString()) {
            return (String) id.value();
        }
        return new String(BODY_CODEC.pack(id.value()), StandardCharsets.UTF_8);
    }

    public HttpStatus status() {
        return headers.status();
    }

    /** Headers, names matched case-insensitively. */
    public ResponseHeaders headers() {
        return headers;
    }

    public String header(CharSequence name) {
        return headers.get(name);
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /** Hands the response to an Armeria service. */
    public com.linecorp.armeria.common.HttpResponse toArmeria() {
        return com.linecorp.armeria.common.HttpResponse.of(headers, HttpData.wrap(body));
    }

    @Override
    public String toString() {
        return "HttpResponse{headers=" + headers + ", body=" + bodyAsString() + "}";
    }
}
