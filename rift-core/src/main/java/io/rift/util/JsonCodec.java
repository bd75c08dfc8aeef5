package io.rift.util;

import java.util.Map;

/**
 * Codec for JSON documents stored alongside events: event metadata and
 * audit-log details.
 *
 * <p>Encoding is canonical: object keys are emitted in sorted order at every
 * nesting level and no insignificant whitespace is produced, so two logically
 * equal documents always encode to the same string. Duplicate detection relies
 * on this.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a document as canonical JSON. A {@code null} document encodes as {@code {}}.
     *
     * @param document the document to encode
     * @return canonical JSON string (never {@code null})
     * @throws IllegalArgumentException if the document contains values that cannot be encoded
     */
    String toCanonicalJson(Map<String, ?> document);
}
