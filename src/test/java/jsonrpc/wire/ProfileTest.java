package jsonrpc.wire;

import jsonrpc.TestMethods.Method;
import jsonrpc.codec.DataFormat;
import jsonrpc.codec.UnpackException;
import jsonrpc.messaging.Id;
import jsonrpc.messaging.Request;
import org.junit.jupiter.api.Test;

import static jsonrpc.TestMethods.binding;
import static jsonrpc.TestMethods.bytes;
import static org.junit.jupiter.api.Assertions.*;

class ProfileTest {

    private final RpcBinding<Method, String> constrained =
            binding(WireMode.COMPACT, DataFormat.JSON, Profile.CONSTRAINED, String.class);

    @Test
    void shouldAcceptAnyIdInStandardProfile() {
        assertTrue(Profile.STANDARD.accepts(Id.of("abc")));
        assertTrue(Profile.STANDARD.accepts(Id.of(-1L)));
        assertEquals(Integer.MAX_VALUE, Profile.STANDARD.textStorage().capacity());
    }

    @Test
    void shouldAcceptOnlyUnsigned32IdsInConstrainedProfile() {
        assertTrue(Profile.CONSTRAINED.accepts(Id.of(4294967295L)));
        assertFalse(Profile.CONSTRAINED.accepts(Id.of(4294967296L)));
        assertFalse(Profile.CONSTRAINED.accepts(Id.of("1")));
        assertEquals(128, Profile.CONSTRAINED.textStorage().capacity());
    }

    @Test
    void shouldRejectStringIdOnDecode() {
        assertThrows(UnpackException.class, () -> constrained.decodeRequest(bytes("{\"i\":\"abc\",\"m\":\"test\"}")));
    }

    @Test
    void shouldRejectOverlongMethodTagOnDecode() {
        String tag = "t".repeat(129);

        assertThrows(UnpackException.class, () -> constrained.decodeRequest(bytes("{\"i\":1,\"m\":\"" + tag + "\"}")));
    }

    @Test
    void shouldRejectOverlongErrorMessageOnDecode() {
        String message = "m".repeat(129);

        assertThrows(UnpackException.class, () -> constrained.decodeResponse(
                bytes("{\"i\":1,\"e\":{\"code\":-32603,\"message\":\"" + message + "\"}}")));
    }

    @Test
    void shouldDecodeWithinLimits() {
        Request<Method> request = constrained.decodeRequest(bytes("{\"i\":4294967295,\"m\":\"test\",\"p\":{}}"));

        assertEquals(Id.of(4294967295L), request.id());
    }

    @Test
    void shouldParseProfileNames() {
        assertEquals(Profile.CONSTRAINED, Profile.parse("constrained"));
        assertThrows(IllegalArgumentException.class, () -> Profile.parse("tiny"));
    }
}
