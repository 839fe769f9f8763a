package org.Aayush.navigation.matching;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Pattern matched against some portion of a URL pathname.
 *
 * <p>The path may contain {@code :name} segments and may end with {@code /*} to
 * capture the rest of the pathname.</p>
 */
@Value
@Builder
public class PathPattern {
    @NonNull
    String path;

    /** Match static segments with their exact case. */
    boolean caseSensitive;

    /** Require the pattern to consume the whole pathname (trailing slashes aside). */
    @Builder.Default
    boolean end = true;

    /**
     * Case-insensitive pattern that must match the entire pathname.
     */
    public static PathPattern of(String path) {
        return PathPattern.builder().path(path).build();
    }
}
