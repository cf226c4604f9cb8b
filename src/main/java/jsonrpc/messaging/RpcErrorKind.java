package jsonrpc.messaging;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * RpcErrorKind is an extensible error-code constant bound to a signed 16-bit wire code.
 * <p>
 * The five JSON-RPC 2.0 reserved codes are canonical instances held in a registry, so
 * {@link #of(short)} returns the same instance for them. Every other code maps to a
 * custom kind. The mapping is total in both directions and cannot fail.
 */
public final class RpcErrorKind {

    // ===== Reserved codes ====================================================
    public static final short PARSE_ERROR_CODE      = -32700;
    public static final short INVALID_REQUEST_CODE  = -32600;
    public static final short METHOD_NOT_FOUND_CODE = -32601;
    public static final short INVALID_PARAMS_CODE   = -32602;
    public static final short INTERNAL_ERROR_CODE   = -32603;

    // ===== Static registry (code → reserved instance) ========================
    private static final Map<Short, RpcErrorKind> RESERVED = new ConcurrentHashMap<>();

    private static RpcErrorKind reserve(String name, short code) {
        RpcErrorKind kind = new RpcErrorKind(name, code);
        RESERVED.put(code, kind);
        return kind;
    }

    public static final RpcErrorKind PARSE_ERROR      = reserve("ParseError",     PARSE_ERROR_CODE);
    public static final RpcErrorKind INVALID_REQUEST  = reserve("InvalidRequest", INVALID_REQUEST_CODE);
    public static final RpcErrorKind METHOD_NOT_FOUND = reserve("MethodNotFound", METHOD_NOT_FOUND_CODE);
    /** Reserved for handlers; never raised by the protocol layer itself. */
    public static final RpcErrorKind INVALID_PARAMS   = reserve("InvalidParams",  INVALID_PARAMS_CODE);
    public static final RpcErrorKind INTERNAL_ERROR   = reserve("InternalError",  INTERNAL_ERROR_CODE);

    /**
     * Maps a wire code to its kind: one of the reserved constants, or a custom kind
     * for any other value.
     */
    public static RpcErrorKind of(short code) {
        RpcErrorKind reserved = RESERVED.get(code);
        return reserved != null ? reserved : new RpcErrorKind(null, code);
    }

    /**
     * Creates a custom, application-defined kind. A code that collides with one of the
     * reserved values yields the reserved constant instead.
     */
    public static RpcErrorKind custom(short code) {
        return of(code);
    }

    /**
     * Maps an arbitrary integer taken from the wire.
     *
     * @throws IllegalArgumentException if the value does not fit in a signed 16-bit integer
     */
    public static RpcErrorKind fromWire(long code) {
        if (code < Short.MIN_VALUE || code > Short.MAX_VALUE) {
            throw new IllegalArgumentException("Error code out of 16-bit range: " + code);
        }
        return of((short) code);
    }

    // ===== Instance fields ===================================================
    private final String name;
    private final short code;

    private RpcErrorKind(String name, short code) {
        this.name = name;
        this.code = code;
    }

    public short code() { return code; }

    public boolean isCustom() { return name == null; }

    /** Symbolic name of a reserved kind, or {@code Custom(code)}. */
    public String name() {
        return name != null ? name : "Custom(" + code + ")";
    }

    // ===== Equality & hashing ================================================
    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RpcErrorKind)) return false;
        return code == ((RpcErrorKind) o).code;
    }

    @Override public int hashCode() { return Short.hashCode(code); }

    @Override public String toString() { return Short.toString(code); }
}
