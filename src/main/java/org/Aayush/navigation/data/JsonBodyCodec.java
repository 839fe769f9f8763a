package org.Aayush.navigation.data;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Parses JSON response bodies returned by loaders and actions.
 */
public final class JsonBodyCodec {
    private static final JsonBodyCodec DEFAULT = new JsonBodyCodec(new ObjectMapper());

    private final ObjectMapper mapper;

    public JsonBodyCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Shared codec backed by a plain {@link ObjectMapper}.
     */
    public static JsonBodyCodec defaults() {
        return DEFAULT;
    }

    /**
     * Reads the body of a JSON response.
     *
     * <p>String and byte bodies are parsed into maps, lists and scalars. Other bodies
     * are already objects and are returned unchanged.</p>
     *
     * @throws IllegalArgumentException when the body is not valid JSON.
     */
    public Object readBody(Object body) {
        try {
            if (body instanceof String text) {
                return text.isBlank() ? null : mapper.readValue(text, Object.class);
            }
            if (body instanceof byte[] bytes) {
                return bytes.length == 0 ? null : mapper.readValue(bytes, Object.class);
            }
            return body;
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse JSON response body", e);
        }
    }
}
