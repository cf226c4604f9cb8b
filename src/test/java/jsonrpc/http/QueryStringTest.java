package jsonrpc.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.linecorp.armeria.common.QueryParams;
import jsonrpc.TestMethods;
import jsonrpc.TestMethods.Method;
import jsonrpc.messaging.Id;
import jsonrpc.messaging.Request;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryStringTest {

    @Test
    void shouldEncodeIdFirstThenMethodThenParams() {
        // Given
        Request<Method> request = Request.create(Id.of(1L), new Method.Hello("world"));

        // When
        QueryString query = QueryString.fromRequest(request, TestMethods.SCHEMA);

        // Then
        assertEquals("i=1&m=hello&name=world", query.toString());
    }

    @Test
    void shouldRoundTripRequest() {
        // Given
        Request<Method> request = Request.create(Id.of(1L), new Method.Hello("world"));

        // When
        Request<Method> decoded = QueryString.fromRequest(request, TestMethods.SCHEMA).toRequest(TestMethods.SCHEMA);

        // Then
        assertEquals(request, decoded);
    }

    @Test
    void shouldEncodeStringIdAsJsonText() {
        // Given
        Request<Method> request = Request.create(Id.of("call 1"), new Method.Ping());

        // When
        QueryString query = QueryString.fromRequest(request, TestMethods.SCHEMA);

        // Then
        assertEquals("i=%22call+1%22&m=test", query.toString());
        assertEquals(request, query.toRequest(TestMethods.SCHEMA));
    }

    @Test
    void shouldKeepIdPairApartFromParameterOfSameName() {
        // Given
        Request<Method> request = Request.create(Id.of(7L), new Method.ListItems("x"));

        // When
        QueryString query = QueryString.fromRequest(request, TestMethods.SCHEMA);

        // Then
        assertEquals("i=7&m=list&i=x", query.toString());
        assertEquals(request, new QueryString(query.toString()).toRequest(TestMethods.SCHEMA));
    }

    @Test
    void shouldDecodeFromQueryParams() {
        QueryString query = new QueryString(QueryParams.of("m", "hello", "name", "world"));

        assertEquals(Request.fireAndForget(new Method.Hello("world")), query.toRequest(TestMethods.SCHEMA));
    }

    @Test
    void shouldOmitIdOfFireAndForgetRequest() {
        QueryString query = QueryString.fromRequest(Request.fireAndForget(new Method.Add(1, -2)), TestMethods.SCHEMA);

        assertEquals("m=add&a=1&b=-2", query.toString());
        assertEquals(Request.fireAndForget(new Method.Add(1, -2)), query.toRequest(TestMethods.SCHEMA));
    }

    @Test
    void shouldRejectNonScalarParameter() {
        // Given
        Request<Method> request = Request.create(Id.of(1L), new Method.Tag(List.of("a", "b")));

        // When
        HttpConversionException e = assertThrows(HttpConversionException.class,
                () -> QueryString.fromRequest(request, TestMethods.SCHEMA));

        // Then
        assertTrue(e.getMessage().contains("unsupported value type for field 'tags'"));
    }

    @Test
    void shouldFailWhenMethodIsMissing() {
        HttpConversionException e = assertThrows(HttpConversionException.class,
                () -> new QueryString("i=1&name=world").toRequest(TestMethods.SCHEMA));
        assertTrue(e.getMessage().contains("the method is missing"));
    }

    @Test
    void shouldReadIdOnlyFromFirstPair() {
        Request<Method> request = new QueryString("m=list&i=abc").toRequest(TestMethods.SCHEMA);

        assertFalse(request.expectsResponse());
        assertEquals(new Method.ListItems("abc"), request.method());
    }

    @Test
    void shouldFailForIdThatIsNotJson() {
        assertThrows(HttpConversionException.class, () -> new QueryString("i=abc&m=test").toRequest(TestMethods.SCHEMA));
    }

    @Test
    void shouldFailForParamsNotMatchingMethod() {
        assertThrows(HttpConversionException.class,
                () -> new QueryString("m=hello&nom=world").toRequest(TestMethods.SCHEMA));
    }

    @Test
    void shouldDecodePercentEncodedValues() {
        Request<Method> request = new QueryString("m=hello&name=J%C3%BCrgen+M").toRequest(TestMethods.SCHEMA);

        assertEquals(new Method.Hello("Jürgen M"), request.method());
    }

    @Test
    void shouldInferScalarTypes() {
        assertTrue(QueryString.parseScalar("true").booleanValue());
        assertTrue(QueryString.parseScalar("false").isBoolean());
        assertTrue(QueryString.parseScalar("null").isNull());

        JsonNode unsigned = QueryString.parseScalar("18446744073709551615");
        assertTrue(unsigned.isIntegralNumber());
        assertEquals(new BigInteger("18446744073709551615"), unsigned.bigIntegerValue());

        assertEquals(-5L, QueryString.parseScalar("-5").longValue());
        assertTrue(QueryString.parseScalar("-5").isIntegralNumber());
        assertEquals(1.5, QueryString.parseScalar("1.5").doubleValue());
        assertTrue(QueryString.parseScalar("1e3").isDouble());

        assertEquals("NaN", QueryString.parseScalar("NaN").textValue());
        assertEquals("Infinity", QueryString.parseScalar("Infinity").textValue());
        assertEquals("abc", QueryString.parseScalar("abc").textValue());
        assertEquals("", QueryString.parseScalar("").textValue());
    }
}
