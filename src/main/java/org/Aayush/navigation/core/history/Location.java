package org.Aayush.navigation.core.history;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.concurrent.ThreadLocalRandom;

/**
 * One entry of a history stack: a URL path plus arbitrary state and a unique key.
 *
 * <p>The initial entry of a history always carries the key {@code "default"}.</p>
 */
@Value
@Builder(toBuilder = true)
@With
public class Location {
    public static final String DEFAULT_KEY = "default";

    /** URL pathname beginning with {@code /}. */
    String pathname;
    /** Search string beginning with {@code ?}, or empty. */
    String search;
    /** Fragment identifier beginning with {@code #}, or empty. */
    String hash;
    /** Caller supplied state attached to this entry. */
    Object state;
    /** Unique key of this entry. */
    String key;

    /**
     * Creates a location for {@code to}, resolving against the current pathname when
     * {@code to} carries no pathname of its own.
     *
     * @param currentPathname pathname used when {@code to} has none.
     * @param to target path.
     * @param state entry state.
     * @param key explicit key, or null to generate one.
     */
    public static Location create(String currentPathname, Path to, Object state, String key) {
        String pathname = to.pathname().isEmpty() ? currentPathname : to.pathname();
        return Location.builder()
                .pathname(pathname)
                .search(to.search())
                .hash(to.hash())
                .state(state)
                .key(key != null ? key : createKey())
                .build();
    }

    /**
     * Creates a location from a string URL path with a generated key.
     */
    public static Location create(String currentPathname, String to, Object state) {
        return create(currentPathname, Path.parse(to), state, null);
    }

    /**
     * Creates the initial location of a history stack.
     */
    public static Location initial(String href) {
        return create("/", Path.parse(href), null, DEFAULT_KEY);
    }

    /**
     * Drops the entry-specific parts and returns the URL components.
     */
    public Path toPath() {
        return new Path(pathname, search, hash);
    }

    /**
     * Renders this location as a string URL path.
     */
    public String toHref() {
        return toPath().toHref();
    }

    private static String createKey() {
        String key = Long.toString(ThreadLocalRandom.current().nextLong() & Long.MAX_VALUE, 36);
        return key.length() > 8 ? key.substring(0, 8) : key;
    }
}
