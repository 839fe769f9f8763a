package org.Aayush.navigation.core.path;

import lombok.experimental.UtilityClass;
import org.Aayush.navigation.core.history.Path;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pathname arithmetic shared by matching, redirect resolution and navigation.
 */
@UtilityClass
public final class PathUtils {
    private static final Pattern REPEATED_SLASHES = Pattern.compile("/{2,}");
    private static final Pattern TRAILING_SLASHES = Pattern.compile("/+\\z");
    private static final Pattern LEADING_SLASHES = Pattern.compile("^/*");

    /**
     * Joins path pieces with {@code /} and collapses repeated slashes.
     */
    public static String joinPaths(String... paths) {
        return REPEATED_SLASHES.matcher(String.join("/", paths)).replaceAll("/");
    }

    /**
     * Joins path pieces with {@code /} and collapses repeated slashes.
     */
    public static String joinPaths(List<String> paths) {
        return joinPaths(paths.toArray(new String[0]));
    }

    /**
     * Drops trailing slashes and forces exactly one leading slash.
     */
    public static String normalizePathname(String pathname) {
        String trimmed = TRAILING_SLASHES.matcher(pathname).replaceAll("");
        return LEADING_SLASHES.matcher(trimmed).replaceFirst("/");
    }

    /**
     * Returns {@code ""} for an empty search, otherwise a search starting with {@code ?}.
     */
    public static String normalizeSearch(String search) {
        if (search == null || search.isEmpty() || "?".equals(search)) {
            return "";
        }
        return search.startsWith("?") ? search : "?" + search;
    }

    /**
     * Returns {@code ""} for an empty hash, otherwise a hash starting with {@code #}.
     */
    public static String normalizeHash(String hash) {
        if (hash == null || hash.isEmpty() || "#".equals(hash)) {
            return "";
        }
        return hash.startsWith("#") ? hash : "#" + hash;
    }

    /**
     * Removes {@code basename} from the front of {@code pathname}.
     *
     * @return remaining pathname (at least {@code /}), or null when the basename does not apply.
     */
    public static String stripBasename(String pathname, String basename) {
        if (basename == null || "/".equals(basename)) {
            return pathname;
        }
        if (!pathname.toLowerCase(Locale.ROOT).startsWith(basename.toLowerCase(Locale.ROOT))) {
            return null;
        }
        int startIndex = basename.endsWith("/") ? basename.length() - 1 : basename.length();
        if (startIndex < pathname.length() && pathname.charAt(startIndex) != '/') {
            return null;
        }
        String stripped = pathname.substring(startIndex);
        return stripped.isEmpty() ? "/" : stripped;
    }

    /**
     * Resolves {@code to} against {@code fromPathname} the way a relative href would be.
     */
    public static Path resolvePath(Path to, String fromPathname) {
        String toPathname = to.pathname();
        String pathname;
        if (toPathname.isEmpty()) {
            pathname = fromPathname;
        } else if (toPathname.startsWith("/")) {
            pathname = toPathname;
        } else {
            pathname = resolvePathname(toPathname, fromPathname);
        }
        return new Path(pathname, normalizeSearch(to.search()), normalizeHash(to.hash()));
    }

    /**
     * Resolves a possibly relative target against the pathnames of the active route
     * hierarchy.
     *
     * <p>Leading {@code ..} segments climb route pathnames rather than URL segments, so
     * pathless layout and index routes do not change what {@code ..} points to.</p>
     *
     * @param toArg target path (absolute or relative).
     * @param routePathnames pathname bases of the path-contributing matches, root first.
     * @param locationPathname pathname of the current location.
     * @param isPathRelative resolve relative to the location pathname instead of routes.
     */
    public static Path resolveTo(
            Path toArg,
            List<String> routePathnames,
            String locationPathname,
            boolean isPathRelative
    ) {
        boolean isEmptyPath = toArg.pathname().isEmpty();
        String toPathname = isEmptyPath ? "/" : toArg.pathname();
        Path to = toArg;

        String from;
        if (isPathRelative) {
            from = locationPathname;
        } else {
            int routePathnameIndex = routePathnames.size() - 1;
            if (toPathname.startsWith("..")) {
                List<String> toSegments = new ArrayList<>(Arrays.asList(toPathname.split("/", -1)));
                while (!toSegments.isEmpty() && "..".equals(toSegments.get(0))) {
                    toSegments.remove(0);
                    routePathnameIndex -= 1;
                }
                to = to.withPathname(String.join("/", toSegments));
            }
            from = routePathnameIndex >= 0 ? routePathnames.get(routePathnameIndex) : "/";
        }

        Path resolved = resolvePath(to, from);

        boolean hasExplicitTrailingSlash = !"/".equals(toPathname) && toPathname.endsWith("/");
        boolean hasCurrentTrailingSlash = (isEmptyPath || ".".equals(toPathname)) && locationPathname.endsWith("/");
        if (!resolved.pathname().endsWith("/") && (hasExplicitTrailingSlash || hasCurrentTrailingSlash)) {
            resolved = resolved.withPathname(resolved.pathname() + "/");
        }
        return resolved;
    }

    /**
     * Resolves a target relative to the route hierarchy.
     */
    public static Path resolveTo(Path to, List<String> routePathnames, String locationPathname) {
        return resolveTo(to, routePathnames, locationPathname, false);
    }

    private static String resolvePathname(String relativePath, String fromPathname) {
        String base = TRAILING_SLASHES.matcher(fromPathname).replaceAll("");
        List<String> segments = new ArrayList<>(Arrays.asList(base.split("/", -1)));
        for (String segment : relativePath.split("/", -1)) {
            if ("..".equals(segment)) {
                if (segments.size() > 1) {
                    segments.remove(segments.size() - 1);
                }
            } else if (!".".equals(segment)) {
                segments.add(segment);
            }
        }
        return segments.size() > 1 ? String.join("/", segments) : "/";
    }
}
