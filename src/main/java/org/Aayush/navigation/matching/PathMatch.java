package org.Aayush.navigation.matching;

import lombok.Value;

import java.util.Map;

/**
 * Result of matching one {@link PathPattern} against a pathname.
 */
@Value
public class PathMatch {
    /** Decoded values of the pattern's params. */
    Map<String, String> params;
    /** Portion of the pathname that was matched. */
    String pathname;
    /** Matched portion without the splat capture and trailing slashes. */
    String pathnameBase;
    PathPattern pattern;
}
