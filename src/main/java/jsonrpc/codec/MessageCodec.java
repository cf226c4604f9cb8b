package jsonrpc.codec;

/**
 * Turns structurally encodable values into bytes and back, independently of the RPC
 * model. Implementations are interchangeable and must round-trip every envelope value
 * losslessly.
 */
public interface MessageCodec {

    /**
     * Encodes a value into bytes for transmission.
     *
     * @param value the value to encode
     * @return the encoded bytes
     * @throws PackException if the value cannot be encoded or is null
     */
    byte[] pack(Object value);

    /**
     * Decodes bytes into a value of the given type.
     *
     * @param data the encoded bytes
     * @param type the target type
     * @return the decoded value
     * @throws UnpackException if the bytes are not a valid encoding of {@code type}
     */
    <T> T unpack(byte[] data, Class<T> type);

    /**
     * Short name of the data format, e.g. {@code json}.
     */
    String formatName();
}
