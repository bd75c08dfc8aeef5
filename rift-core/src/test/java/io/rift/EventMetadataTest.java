package io.rift;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventMetadataTest {

    @Test
    void nullAndEmptyAreTheEmptyDocument() {
        assertSame(EventMetadata.empty(), EventMetadata.of(null));
        assertSame(EventMetadata.empty(), EventMetadata.of(Map.of()));
        assertEquals("{}", EventMetadata.empty().canonicalJson());
        assertTrue(EventMetadata.empty().isEmpty());
    }

    @Test
    void keyOrderDoesNotAffectCanonicalForm() {
        Map<String, Object> inner1 = new LinkedHashMap<>();
        inner1.put("z", 1);
        inner1.put("a", 2);
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", "x");
        first.put("a", inner1);

        Map<String, Object> inner2 = new LinkedHashMap<>();
        inner2.put("a", 2);
        inner2.put("z", 1);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", inner2);
        second.put("b", "x");

        EventMetadata m1 = EventMetadata.of(first);
        EventMetadata m2 = EventMetadata.of(second);

        assertEquals("{\"a\":{\"a\":2,\"z\":1},\"b\":\"x\"}", m1.canonicalJson());
        assertEquals(m1, m2);
        assertEquals(m1.hashCode(), m2.hashCode());
        assertEquals(m1.fingerprint(), m2.fingerprint());
    }

    @Test
    void differentShapesAreNotEqual() {
        assertNotEquals(EventMetadata.of(Map.of("id", 1)), EventMetadata.of(Map.of("id", "1")));
        assertNotEquals(EventMetadata.of(Map.of("id", List.of(1, 2))), EventMetadata.of(Map.of("id", List.of(2, 1))));
    }

    @Test
    void oversizedMetadataIsRejected() {
        String big = "x".repeat(EventMetadata.MAX_ENCODED_LENGTH);

        InvalidEventException e = assertThrows(InvalidEventException.class, () ->
                EventMetadata.of(Map.of("note", big)));
        assertTrue(e.getMessage().contains("5000"));
    }

    @Test
    void metadataAtTheLimitIsAccepted() {
        // {"n":"..."} adds 8 characters around the value
        String value = "x".repeat(EventMetadata.MAX_ENCODED_LENGTH - 8);

        EventMetadata metadata = EventMetadata.of(Map.of("n", value));

        assertEquals(EventMetadata.MAX_ENCODED_LENGTH, metadata.canonicalJson().length());
    }

    @Test
    void nullKeyIsRejected() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(null, "v");

        assertThrows(InvalidEventException.class, () -> EventMetadata.of(values));
    }

    @Test
    void valuesAreUnmodifiable() {
        EventMetadata metadata = EventMetadata.of(Map.of("k", "v"));

        assertThrows(UnsupportedOperationException.class, () -> metadata.values().put("x", "y"));
    }
}
