package io.rift;

import io.rift.util.Hashing;
import io.rift.util.JsonCodec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Opaque JSON document attached to an event.
 *
 * <p>Metadata is held in its canonical JSON form (keys sorted at every level),
 * which makes equality and the duplicate fingerprint independent of the key
 * order the sender used. Absent metadata is the empty document {@code {}}.
 *
 * <p>The canonical form must not exceed {@value #MAX_ENCODED_LENGTH} characters.
 */
public final class EventMetadata {
    public static final int MAX_ENCODED_LENGTH = 5000;

    private static final EventMetadata EMPTY = new EventMetadata(Map.of(), "{}");

    private final Map<String, Object> values;
    private final String canonicalJson;

    private EventMetadata(Map<String, Object> values, String canonicalJson) {
        this.values = values;
        this.canonicalJson = canonicalJson;
    }

    public static EventMetadata empty() {
        return EMPTY;
    }

    /**
     * Creates metadata from a decoded JSON object.
     *
     * @param values the document, {@code null} meaning empty
     * @return the metadata
     * @throws InvalidEventException if the document cannot be encoded or is too large
     */
    public static EventMetadata of(Map<String, ?> values) {
        return of(values, JsonCodec.getDefault());
    }

    static EventMetadata of(Map<String, ?> values, JsonCodec codec) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        if (values.containsKey(null)) {
            throw new InvalidEventException("Metadata keys must not be null");
        }
        String json;
        try {
            json = codec.toCanonicalJson(values);
        } catch (IllegalArgumentException e) {
            throw new InvalidEventException("Metadata is not a valid JSON object", e);
        }
        if (json.length() > MAX_ENCODED_LENGTH) {
            throw new InvalidEventException(
                    "Metadata exceeds " + MAX_ENCODED_LENGTH + " characters when encoded");
        }
        return new EventMetadata(Collections.unmodifiableMap(new LinkedHashMap<>(values)), json);
    }

    /** Decoded top-level entries, unmodifiable. */
    public Map<String, Object> values() {
        return values;
    }

    /** Canonical JSON encoding, {@code {}} when empty. */
    public String canonicalJson() {
        return canonicalJson;
    }

    /** Hex SHA-256 of the canonical encoding. */
    public String fingerprint() {
        return Hashing.sha256Hex(canonicalJson);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMetadata other)) return false;
        return canonicalJson.equals(other.canonicalJson);
    }

    @Override
    public int hashCode() {
        return canonicalJson.hashCode();
    }

    @Override
    public String toString() {
        return canonicalJson;
    }
}
