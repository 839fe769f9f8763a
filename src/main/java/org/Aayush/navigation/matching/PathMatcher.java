package org.Aayush.navigation.matching;

import lombok.experimental.UtilityClass;
import org.Aayush.navigation.core.path.UriDecoding;
import org.Aayush.navigation.router.RouterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles path patterns and matches or generates pathnames with them.
 */
@UtilityClass
public final class PathMatcher {
    private static final Logger log = LoggerFactory.getLogger(PathMatcher.class);

    public static final String SPLAT = "*";

    private static final Pattern TRAILING_SLASH_SPLAT = Pattern.compile("/*\\*?\\z");
    private static final Pattern LEADING_SLASHES = Pattern.compile("^/*");
    private static final Pattern REGEX_SPECIAL = Pattern.compile("[\\\\.*+^$?{}|()\\[\\]]");
    private static final Pattern PARAM = Pattern.compile(":(\\w+)");
    private static final Pattern SLASH_SPLAT = Pattern.compile("(/?)\\*");
    private static final Pattern TRAILING_SLASHES_AFTER_CHAR = Pattern.compile("(.)/+\\z");
    private static final Pattern TRAILING_SLASHES = Pattern.compile("/+\\z");

    /**
     * Compiles {@code path} into a matcher.
     *
     * <p>A path ending in {@code *} without a preceding {@code /} is treated as if it
     * ended in {@code /*}, and a warning is logged.</p>
     *
     * @param path route path pattern.
     * @param caseSensitive match static segments with their exact case.
     * @param end require the match to consume the whole pathname.
     */
    public static CompiledPath compilePath(String path, boolean caseSensitive, boolean end) {
        Objects.requireNonNull(path, "path");
        if (!SPLAT.equals(path) && path.endsWith("*") && !path.endsWith("/*")) {
            String suggested = path.substring(0, path.length() - 1) + "/*";
            log.warn("Route path \"{}\" will be treated as if it were \"{}\" because the `*` character must "
                    + "always follow a `/` in the pattern. To get rid of this warning, please change the route "
                    + "path to \"{}\".", path, suggested, suggested);
        }

        List<String> paramNames = new ArrayList<>();
        String source = TRAILING_SLASH_SPLAT.matcher(path).replaceFirst("");
        source = LEADING_SLASHES.matcher(source).replaceFirst("/");
        source = REGEX_SPECIAL.matcher(source).replaceAll("\\\\$0");

        Matcher params = PARAM.matcher(source);
        StringBuilder regex = new StringBuilder("^");
        while (params.find()) {
            paramNames.add(params.group(1));
            params.appendReplacement(regex, Matcher.quoteReplacement("([^/]+)"));
        }
        params.appendTail(regex);

        if (path.endsWith("*")) {
            paramNames.add(SPLAT);
            regex.append(SPLAT.equals(path) || "/*".equals(path)
                    ? "(.*)\\z"
                    : "(?:/(.+)|/*)\\z");
        } else if (end) {
            regex.append("/*\\z");
        } else if (!path.isEmpty() && !"/".equals(path)) {
            // Partial matches must stop at a segment boundary.
            regex.append("(?:(?=/|\\z))");
        }

        Pattern matcher = caseSensitive
                ? Pattern.compile(regex.toString())
                : Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new CompiledPath(matcher, paramNames);
    }

    /**
     * Matches {@code pathname} against a case-insensitive pattern that must consume the
     * whole pathname.
     *
     * @return match or null.
     */
    public static PathMatch matchPath(String pattern, String pathname) {
        return matchPath(PathPattern.of(pattern), pathname);
    }

    /**
     * Matches {@code pathname} against {@code pattern}.
     *
     * @return match or null.
     */
    public static PathMatch matchPath(PathPattern pattern, String pathname) {
        Objects.requireNonNull(pattern, "pattern");
        return matchPath(pattern, compilePath(pattern.getPath(), pattern.isCaseSensitive(), pattern.isEnd()), pathname);
    }

    static PathMatch matchPath(PathPattern pattern, CompiledPath compiled, String pathname) {
        Objects.requireNonNull(pathname, "pathname");
        Matcher match = compiled.matcher().matcher(pathname);
        if (!match.find()) {
            return null;
        }

        String matchedPathname = match.group();
        String pathnameBase = TRAILING_SLASHES_AFTER_CHAR.matcher(matchedPathname).replaceFirst("$1");
        Map<String, String> params = new LinkedHashMap<>();
        List<String> paramNames = compiled.paramNames();
        for (int i = 0; i < paramNames.size(); i++) {
            String paramName = paramNames.get(i);
            String captured = match.group(i + 1);
            String value = captured == null ? "" : captured;
            if (SPLAT.equals(paramName)) {
                String beforeSplat = matchedPathname.substring(0, matchedPathname.length() - value.length());
                pathnameBase = TRAILING_SLASHES.matcher(beforeSplat).replaceFirst("");
            }
            params.put(paramName, UriDecoding.safelyDecodeUriComponent(value, paramName));
        }
        return new PathMatch(Collections.unmodifiableMap(params), matchedPathname, pathnameBase, pattern);
    }

    /**
     * Interpolates {@code params} into {@code path}.
     *
     * <p>Every {@code :name} segment needs a param. A trailing {@code *} takes the
     * {@code *} param; without one it becomes {@code /} for a {@code /*} path and
     * empty otherwise.</p>
     *
     * @throws RouterException when a named param is missing.
     */
    public static String generatePath(String path, Map<String, String> params) {
        Objects.requireNonNull(path, "path");
        Map<String, String> values = params == null ? Map.of() : params;

        Matcher named = PARAM.matcher(path);
        StringBuilder withParams = new StringBuilder();
        while (named.find()) {
            String key = named.group(1);
            String value = values.get(key);
            if (value == null) {
                throw new RouterException(RouterException.REASON_MISSING_PATH_PARAM, "Missing \":" + key + "\" param");
            }
            named.appendReplacement(withParams, Matcher.quoteReplacement(value));
        }
        named.appendTail(withParams);

        String interpolated = withParams.toString();
        Matcher splat = SLASH_SPLAT.matcher(interpolated);
        if (!splat.find()) {
            return interpolated;
        }
        String star = values.get(SPLAT);
        String replacement;
        if (star == null) {
            replacement = "/*".equals(interpolated) ? "/" : "";
        } else {
            replacement = splat.group(1) + star;
        }
        return interpolated.substring(0, splat.start()) + replacement + interpolated.substring(splat.end());
    }
}
