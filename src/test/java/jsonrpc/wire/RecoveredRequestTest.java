package jsonrpc.wire;

import jsonrpc.messaging.Id;
import jsonrpc.messaging.Response;
import jsonrpc.messaging.RpcError;
import jsonrpc.messaging.RpcErrorKind;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RecoveredRequestTest {

    @Test
    void shouldReportMethodNotFoundForCorrectMarker() {
        RecoveredRequest recovered = new RecoveredRequest(WireMode.CANONICAL, "2.0", Id.of(3L));

        assertEquals(RpcError.of(RpcErrorKind.METHOD_NOT_FOUND, "decode failed"), recovered.error("decode failed"));
    }

    @Test
    void shouldReportInvalidProtocolVersionForWrongMarker() {
        RecoveredRequest recovered = new RecoveredRequest(WireMode.CANONICAL, "1.0", Id.of(3L));

        assertEquals(RpcError.of(RpcErrorKind.INVALID_REQUEST, "Invalid protocol version"),
                recovered.error("decode failed"));
    }

    @Test
    void shouldReportBareInvalidRequestForMissingMarker() {
        RecoveredRequest recovered = new RecoveredRequest(WireMode.CANONICAL, null, Id.of(3L));

        assertEquals(RpcError.of(RpcErrorKind.INVALID_REQUEST), recovered.error("decode failed"));
    }

    @Test
    void shouldAlwaysReportMethodNotFoundInCompactMode() {
        assertEquals(RpcErrorKind.METHOD_NOT_FOUND,
                new RecoveredRequest(WireMode.COMPACT, null, Id.of(1L)).error("x").kind());
        assertEquals(RpcErrorKind.METHOD_NOT_FOUND,
                new RecoveredRequest(WireMode.COMPACT, "1.0", Id.of(1L)).error("x").kind());
    }

    @Test
    void shouldProduceNoResponseWithoutId() {
        Optional<Response<String>> response = new RecoveredRequest(WireMode.CANONICAL, "2.0", null).toResponse("x");

        assertTrue(response.isEmpty());
    }

    @Test
    void shouldAnswerToRecoveredId() {
        Response<String> response = new RecoveredRequest(WireMode.COMPACT, null, Id.of("abc"))
                .<String>toResponse("x").orElseThrow();

        assertEquals(Id.of("abc"), response.id());
        assertFalse(response.isSuccess());
    }
}
