package org.Aayush.navigation.data;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered multi-map of form fields.
 *
 * <p>Values are either text or binary file content. Binary values cannot be
 * serialized into a URL search string.</p>
 */
public final class FormData {
    private final List<Entry> entries = new ArrayList<>();

    /**
     * One form field.
     *
     * @param name field name.
     * @param value text value, or null for binary fields.
     * @param binary binary content, or null for text fields.
     */
    public record Entry(String name, String value, byte[] binary) {
        public Entry {
            Objects.requireNonNull(name, "name");
        }

        public boolean isBinary() {
            return binary != null;
        }
    }

    /**
     * Creates a form from alternating name/value pairs.
     */
    public static FormData of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("namesAndValues must hold name/value pairs");
        }
        FormData formData = new FormData();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            formData.append(namesAndValues[i], namesAndValues[i + 1]);
        }
        return formData;
    }

    public FormData append(String name, String value) {
        entries.add(new Entry(name, Objects.requireNonNull(value, "value"), null));
        return this;
    }

    public FormData appendBinary(String name, byte[] content) {
        entries.add(new Entry(name, null, Objects.requireNonNull(content, "content").clone()));
        return this;
    }

    /**
     * Returns the first text value for {@code name}, or null.
     */
    public String get(String name) {
        for (Entry entry : entries) {
            if (entry.name().equals(name) && !entry.isBinary()) {
                return entry.value();
            }
        }
        return null;
    }

    public List<String> getAll(String name) {
        List<String> values = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.name().equals(name) && !entry.isBinary()) {
                values.add(entry.value());
            }
        }
        return values;
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean hasBinary() {
        for (Entry entry : entries) {
            if (entry.isBinary()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Serializes text fields as {@code application/x-www-form-urlencoded}.
     *
     * @throws IllegalStateException when a binary field is present.
     */
    public String toSearchParams() {
        StringBuilder encoded = new StringBuilder();
        for (Entry entry : entries) {
            if (entry.isBinary()) {
                throw new IllegalStateException("Cannot submit binary form data using GET");
            }
            if (encoded.length() > 0) {
                encoded.append('&');
            }
            encoded.append(URLEncoder.encode(entry.name(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(entry.value(), StandardCharsets.UTF_8));
        }
        return encoded.toString();
    }

    @Override
    public String toString() {
        return "FormData" + entries.stream().map(Entry::name).toList();
    }
}
