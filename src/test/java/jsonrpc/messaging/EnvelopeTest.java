package jsonrpc.messaging;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeTest {

    @Test
    void shouldTreatRequestWithoutIdAsFireAndForget() {
        Request<String> request = Request.fireAndForget("ping");

        assertFalse(request.expectsResponse());
        assertTrue(request.optionalId().isEmpty());
    }

    @Test
    void shouldBuildRequestFromParts() {
        Request<String> request = Request.fromParts(Id.of(3L), "ping");

        assertTrue(request.expectsResponse());
        assertEquals(Id.of(3L), request.optionalId().orElseThrow());
    }

    @Test
    void shouldRequireIdForCreate() {
        assertThrows(NullPointerException.class, () -> Request.create(null, "ping"));
    }

    @Test
    void shouldReplaceOutcomeKeepingId() {
        Response<String> response = Response.success(Id.of(5L), "ok");

        Response<String> replaced = response.toInternalErrorResponse("encode failed");

        assertEquals(Id.of(5L), replaced.id());
        assertFalse(replaced.isSuccess());
        assertEquals(RpcErrorKind.INTERNAL_ERROR, replaced.outcome().error().orElseThrow().kind());
        assertEquals("encode failed", replaced.outcome().error().orElseThrow().message());
    }

    @Test
    void shouldRequireIdOnResponse() {
        assertThrows(NullPointerException.class, () -> Response.success(null, "ok"));
    }
}
