package jsonrpc.wire;

import java.util.Locale;

/**
 * The envelope tagging scheme, fixed per deployment.
 */
public enum WireMode {
    /** Strict JSON-RPC 2.0: {@code jsonrpc}, {@code id}, {@code method}/{@code params}, {@code result}/{@code error}. */
    CANONICAL,
    /** Space-reduced: {@code i}, {@code m}/{@code p}, {@code r}/{@code e}, no version marker. */
    COMPACT;

    public WireFormat newWireFormat(Profile profile) {
        return this == CANONICAL ? new CanonicalWireFormat(profile) : new CompactWireFormat(profile);
    }

    public static WireMode parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Wire mode name cannot be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown wire mode: " + name, e);
        }
    }
}
