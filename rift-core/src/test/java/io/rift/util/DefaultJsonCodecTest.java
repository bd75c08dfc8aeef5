package io.rift.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DefaultJsonCodecTest {
    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void nullEncodesAsEmptyObject() {
        assertEquals("{}", codec.toCanonicalJson(null));
    }

    @Test
    void keysAreSortedAtEveryLevel() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("y", true);
        nested.put("b", null);
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("list", List.of(3, "two"));
        doc.put("inner", nested);

        assertEquals("{\"inner\":{\"b\":null,\"y\":true},\"list\":[3,\"two\"]}", codec.toCanonicalJson(doc));
    }

    @Test
    void unencodableValueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.toCanonicalJson(Map.of("x", new Object())));
    }

    @Test
    void sha256IsLowercaseHex() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", Hashing.sha256Hex(""));
    }
}
