package jsonrpc.cmd;

import jsonrpc.client.PendingCall;
import jsonrpc.client.RpcClient;
import jsonrpc.config.RpcConfig;
import jsonrpc.messaging.RpcErrorKind;
import jsonrpc.messaging.RpcException;
import jsonrpc.server.RpcServer;
import jsonrpc.wire.MethodSchema;
import jsonrpc.wire.RpcBinding;
import jsonrpc.wire.WireMode;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a client and a server in the same process and feeds the client's payloads
 * straight into the server. The protocol setup is read from {@code jsonrpc.properties}
 * when present.
 */
public class ClientServerDemo {

    public interface DemoMethod {
        record Test() implements DemoMethod {}
        record Hello(String name) implements DemoMethod {}
        record ListItems(String i) implements DemoMethod {}
        record Complicated() implements DemoMethod {}
    }

    public static final MethodSchema<DemoMethod> SCHEMA = MethodSchema.builder(DemoMethod.class)
            .method("test", DemoMethod.Test.class)
            .method("hello", DemoMethod.Hello.class)
            .method("list", DemoMethod.ListItems.class)
            .method("complicated", DemoMethod.Complicated.class)
            .build();

    static final short NOT_IMPLEMENTED_CODE = -32000;

    private final RpcClient<DemoMethod, Object> client;
    private final RpcServer<DemoMethod, Object, String> server;

    public ClientServerDemo(RpcConfig config) {
        RpcBinding<DemoMethod, Object> binding = config.bind(SCHEMA, Object.class);
        this.client = new RpcClient<>(binding);
        this.server = new RpcServer<>(binding, ClientServerDemo::handle);
    }

    static Object handle(DemoMethod method, String source) {
        if (method instanceof DemoMethod.Test) {
            return Map.of("ok", true);
        }
        if (method instanceof DemoMethod.Hello hello) {
            return "Hello, " + hello.name();
        }
        if (method instanceof DemoMethod.ListItems list) {
            return "List, " + list.i();
        }
        throw new RpcException(RpcErrorKind.custom(NOT_IMPLEMENTED_CODE), "Complicated method not implemented");
    }

    /**
     * Sends one call through the server and resolves it.
     *
     * @return the result of the call
     * @throws RpcException if the server answered with an error or did not answer
     */
    public Object call(DemoMethod method) {
        PendingCall<Object> call = client.request(method);
        System.out.println("request payload: " + utf8(call.payload()));
        Optional<byte[]> response = server.handlePayload(call.payload(), "local");
        if (response.isEmpty()) {
            throw new RpcException(RpcErrorKind.INTERNAL_ERROR, "no response for call " + call.id().orElse(null));
        }
        System.out.println("response: " + utf8(response.get()));
        return call.handleResponse(response.get());
    }

    /**
     * Feeds a hand-written payload to the server.
     *
     * @return the server's answer, or empty if it sent none
     */
    public Optional<String> send(String rawPayload) {
        System.out.println("request payload: " + rawPayload);
        Optional<String> response = server.handlePayload(rawPayload.getBytes(StandardCharsets.UTF_8), "local")
                .map(ClientServerDemo::utf8);
        response.ifPresent(r -> System.out.println("response: " + r));
        return response;
    }

    private static String utf8(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public static void main(String[] args) {
        RpcConfig config = RpcConfig.load();
        System.out.println("Using " + config);
        ClientServerDemo demo = new ClientServerDemo(config);

        DemoMethod[] calls = {
                new DemoMethod.Test(),
                new DemoMethod.Hello("world"),
                new DemoMethod.ListItems("abc"),
                new DemoMethod.Complicated()
        };
        for (DemoMethod method : calls) {
            try {
                System.out.println("result: " + demo.call(method));
            } catch (RpcException e) {
                System.out.println("error: " + e.getError());
            }
        }

        demo.send(config.wireMode() == WireMode.CANONICAL
                ? "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"test\",\"params\":{\"abc\":123}}"
                : "{\"i\":3,\"m\":\"test\",\"p\":{\"abc\":123}}");
    }
}
