package jsonrpc.codec;

import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

/**
 * Compact binary codec (CBOR). Objects are written as maps keyed by field name, so the
 * envelope field names of the active wire mode apply unchanged.
 */
public final class CborMessageCodec extends JacksonMessageCodec {

    public CborMessageCodec() {
        super(createConfiguredObjectMapper());
    }

    public static ObjectMapper createConfiguredObjectMapper() {
        return CBORMapper.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    @Override
    public String formatName() {
        return "cbor";
    }
}
