package org.Aayush.navigation.core.history;

import java.util.Objects;

/**
 * Pathname, search and hash components of a URL.
 *
 * <p>{@code search} starts with {@code ?} and {@code hash} with {@code #} when non-empty.</p>
 *
 * @param pathname URL pathname, normally beginning with {@code /}.
 * @param search search string or empty.
 * @param hash fragment identifier or empty.
 */
public record Path(String pathname, String search, String hash) {

    public Path {
        pathname = pathname == null ? "" : pathname;
        search = search == null ? "" : search;
        hash = hash == null ? "" : hash;
    }

    /**
     * Creates a path with only a pathname.
     */
    public static Path of(String pathname) {
        return new Path(pathname, "", "");
    }

    /**
     * Parses a URL path string into its pathname, search and hash components.
     *
     * <p>Missing components stay empty; an input without a pathname yields an empty
     * pathname so callers can decide how to fall back.</p>
     */
    public static Path parse(String path) {
        if (path == null || path.isEmpty()) {
            return new Path("", "", "");
        }
        String rest = path;
        String hash = "";
        int hashIndex = rest.indexOf('#');
        if (hashIndex >= 0) {
            hash = rest.substring(hashIndex);
            rest = rest.substring(0, hashIndex);
        }
        String search = "";
        int searchIndex = rest.indexOf('?');
        if (searchIndex >= 0) {
            search = rest.substring(searchIndex);
            rest = rest.substring(0, searchIndex);
        }
        return new Path(rest, search, hash);
    }

    /**
     * Renders pathname, search and hash into one string URL path.
     */
    public String toHref() {
        StringBuilder href = new StringBuilder(pathname.isEmpty() ? "/" : pathname);
        if (!search.isEmpty() && !"?".equals(search)) {
            href.append(search.charAt(0) == '?' ? search : "?" + search);
        }
        if (!hash.isEmpty() && !"#".equals(hash)) {
            href.append(hash.charAt(0) == '#' ? hash : "#" + hash);
        }
        return href.toString();
    }

    /**
     * Returns a copy with a replaced pathname.
     */
    public Path withPathname(String newPathname) {
        return new Path(newPathname, search, hash);
    }

    /**
     * Returns a copy with a replaced search string.
     */
    public Path withSearch(String newSearch) {
        return new Path(pathname, newSearch, hash);
    }

    /**
     * Returns a copy without a fragment identifier.
     */
    public Path withoutHash() {
        return new Path(pathname, search, "");
    }

    /**
     * Returns true when both paths share pathname and search but differ in hash.
     */
    public static boolean isHashChangeOnly(Path current, Path next) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(next, "next");
        return current.pathname.equals(next.pathname)
                && current.search.equals(next.search)
                && !current.hash.equals(next.hash);
    }

    @Override
    public String toString() {
        return toHref();
    }
}
