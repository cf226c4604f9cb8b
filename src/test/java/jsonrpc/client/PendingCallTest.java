package jsonrpc.client;

import jsonrpc.TestMethods.Method;
import jsonrpc.messaging.RpcErrorKind;
import jsonrpc.messaging.RpcException;
import jsonrpc.wire.RpcBinding;
import jsonrpc.wire.WireMode;
import org.junit.jupiter.api.Test;

import static jsonrpc.TestMethods.binding;
import static jsonrpc.TestMethods.bytes;
import static org.junit.jupiter.api.Assertions.*;

class PendingCallTest {

    private final RpcBinding<Method, String> binding = binding(WireMode.COMPACT, String.class);
    private final RpcClient<Method, String> client = new RpcClient<>(binding);

    @Test
    void shouldReturnResultOfMatchingResponse() {
        PendingCall<String> call = client.request(new Method.Hello("world"));

        assertEquals("Hello, world", call.handleResponse(bytes("{\"i\":0,\"r\":\"Hello, world\"}")));
    }

    @Test
    void shouldThrowServerError() {
        // Given
        PendingCall<String> call = client.request(new Method.Complicated());

        // When
        RpcException e = assertThrows(RpcException.class,
                () -> call.handleResponse(bytes("{\"i\":0,\"e\":{\"code\":-32000,\"message\":\"X\"}}")));

        // Then
        assertEquals(RpcErrorKind.custom((short) -32000), e.getKind());
        assertEquals("X", e.getError().message());
    }

    @Test
    void shouldRejectResponseToAnotherCall() {
        // Given
        PendingCall<String> call = client.request(new Method.Ping());

        // When
        RpcException e = assertThrows(RpcException.class, () -> call.handleResponse(bytes("{\"i\":99,\"r\":\"x\"}")));

        // Then
        assertEquals(RpcErrorKind.INVALID_REQUEST, e.getKind());
        assertEquals(PendingCall.ERR_ID_MISMATCH, e.getError().message());
    }

    @Test
    void shouldRejectResponseForFireAndForgetCall() {
        // Given
        PendingCall<String> call = client.requestFireAndForget(new Method.Ping());

        // When
        RpcException e = assertThrows(RpcException.class, () -> call.handleResponse(bytes("{\"i\":0,\"r\":\"x\"}")));

        // Then
        assertEquals(RpcErrorKind.INVALID_REQUEST, e.getKind());
        assertEquals(PendingCall.ERR_ID_MISSING, e.getError().message());
    }

    @Test
    void shouldReportUndecodableResponseAsParseError() {
        // Given
        PendingCall<String> call = client.request(new Method.Ping());

        // When
        RpcException garbage = assertThrows(RpcException.class, () -> call.handleResponse(bytes("not json")));
        RpcException noId = assertThrows(RpcException.class, () -> call.handleResponse(bytes("{\"r\":\"x\"}")));

        // Then
        assertEquals(RpcErrorKind.PARSE_ERROR, garbage.getKind());
        assertEquals(RpcErrorKind.PARSE_ERROR, noId.getKind());
    }

    @Test
    void shouldNotMatchStringIdAgainstNumericId() {
        PendingCall<String> call = client.request(new Method.Ping());

        RpcException e = assertThrows(RpcException.class, () -> call.handleResponse(bytes("{\"i\":\"0\",\"r\":\"x\"}")));

        assertEquals(RpcErrorKind.INVALID_REQUEST, e.getKind());
    }
}
