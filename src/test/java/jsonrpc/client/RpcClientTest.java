package jsonrpc.client;

import jsonrpc.TestMethods.Method;
import jsonrpc.messaging.Id;
import jsonrpc.wire.RpcBinding;
import jsonrpc.wire.WireMode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static jsonrpc.TestMethods.binding;
import static jsonrpc.TestMethods.utf8;
import static org.junit.jupiter.api.Assertions.*;

class RpcClientTest {

    private final RpcBinding<Method, String> binding = binding(WireMode.COMPACT, String.class);

    @Test
    void shouldAllocateSequentialIdsStartingAtZero() {
        RpcClient<Method, String> client = new RpcClient<>(binding);

        PendingCall<String> first = client.request(new Method.Ping());
        PendingCall<String> second = client.request(new Method.Ping());

        assertEquals(Id.of(0L), first.id().orElseThrow());
        assertEquals(Id.of(1L), second.id().orElseThrow());
        assertEquals("{\"i\":0,\"m\":\"test\",\"p\":{}}", utf8(first.payload()));
    }

    @Test
    void shouldWrapCounterAsUnsigned() {
        // Given
        RpcClient<Method, String> client = new RpcClient<>(binding, -1);

        // When
        PendingCall<String> first = client.request(new Method.Ping());
        PendingCall<String> second = client.request(new Method.Ping());

        // Then
        assertEquals(Id.of(4294967295L), first.id().orElseThrow());
        assertEquals(Id.of(0L), second.id().orElseThrow());
        assertTrue(utf8(first.payload()).contains("4294967295"));
    }

    @Test
    void shouldNotAllocateIdForFireAndForget() {
        RpcClient<Method, String> client = new RpcClient<>(binding);

        PendingCall<String> call = client.requestFireAndForget(new Method.Hello("world"));
        PendingCall<String> next = client.request(new Method.Ping());

        assertFalse(call.expectsResponse());
        assertTrue(call.id().isEmpty());
        assertEquals("{\"m\":\"hello\",\"p\":{\"name\":\"world\"}}", utf8(call.payload()));
        assertEquals(Id.of(0L), next.id().orElseThrow());
    }

    @Test
    void shouldHandOverPayloadOnce() {
        PendingCall<String> call = new RpcClient<>(binding).request(new Method.Ping());

        byte[] taken = call.takePayload();

        assertTrue(taken.length > 0);
        assertEquals(0, call.payload().length);
    }

    @Test
    void shouldIssueUniqueIdsFromConcurrentCallers() throws Exception {
        // Given
        RpcClient<Method, String> client = new RpcClient<>(binding);
        int threads = 8;
        int callsPerThread = 500;
        Set<Id> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // When
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < callsPerThread; i++) {
                    ids.add(client.request(new Method.Ping()).id().orElseThrow());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertEquals(threads * callsPerThread, ids.size());
    }
}
