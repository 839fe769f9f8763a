package org.Aayush.navigation.data;

import java.util.Locale;

/**
 * HTTP verbs a form submission may use.
 */
public enum FormMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    /**
     * Returns true for verbs that invoke an action instead of a loader.
     */
    public boolean isMutation() {
        return this != GET;
    }

    /**
     * Parses a verb case-insensitively.
     *
     * @throws IllegalArgumentException for unsupported verbs.
     */
    public static FormMethod parse(String method) {
        return valueOf(method.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Lower-case verb as carried on submissions.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
