package jsonrpc.codec;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * The data formats a deployment can select for payload bodies.
 */
public enum DataFormat {
    JSON(JsonMessageCodec::new),
    CBOR(CborMessageCodec::new);

    private final Supplier<MessageCodec> factory;

    DataFormat(Supplier<MessageCodec> factory) {
        this.factory = factory;
    }

    public MessageCodec newCodec() {
        return factory.get();
    }

    /**
     * Parses a format name, ignoring case.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static DataFormat parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Data format name cannot be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown data format: " + name, e);
        }
    }
}
