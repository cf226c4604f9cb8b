package jsonrpc.codec;

import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Human-readable JSON codec.
 */
public final class JsonMessageCodec extends JacksonMessageCodec {

    public JsonMessageCodec() {
        super(createConfiguredObjectMapper());
    }

    /**
     * Creates the ObjectMapper used for JSON payloads. Trailing content and duplicate
     * object keys are rejected.
     */
    public static ObjectMapper createConfiguredObjectMapper() {
        return JsonMapper.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    @Override
    public String formatName() {
        return "json";
    }
}
