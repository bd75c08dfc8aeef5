package io.rift.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Map;

/**
 * Jackson-backed {@link JsonCodec}. Map entries are ordered by key on output,
 * which yields a canonical encoding for nested documents as well.
 */
public final class DefaultJsonCodec implements JsonCodec {
    static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

    private final ObjectMapper mapper;

    public DefaultJsonCodec() {
        this.mapper = JsonMapper.builder()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    @Override
    public String toCanonicalJson(Map<String, ?> document) {
        if (document == null) {
            return "{}";
        }
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document is not JSON-encodable: " + e.getOriginalMessage(), e);
        }
    }
}
