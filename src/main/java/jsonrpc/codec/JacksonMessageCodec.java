package jsonrpc.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * Base for codecs backed by a Jackson {@link ObjectMapper}. Subclasses only choose the
 * underlying data format.
 */
public abstract class JacksonMessageCodec implements MessageCodec {

    private final ObjectMapper objectMapper;

    protected JacksonMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    protected ObjectMapper objectMapper() {
        return objectMapper;
    }

    @Override
    public byte[] pack(Object value) {
        if (value == null) {
            throw new PackException("Cannot encode null object");
        }
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new PackException("Failed to encode " + value.getClass().getSimpleName()
                    + " as " + formatName() + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public <T> T unpack(byte[] data, Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (data == null || data.length == 0) {
            throw new UnpackException("Cannot decode empty " + formatName() + " payload");
        }
        try {
            T value = objectMapper.readValue(data, type);
            if (value == null) {
                throw new UnpackException("Decoded " + formatName() + " payload is null");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new UnpackException("Failed to decode " + formatName() + " to "
                    + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UnpackException("Failed to decode " + formatName() + " to "
                    + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
