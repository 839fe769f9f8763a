package org.Aayush.navigation.router;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.navigation.core.history.Path;
import org.Aayush.navigation.data.ErrorResponse;
import org.Aayush.navigation.data.FormData;
import org.Aayush.navigation.data.FormEncType;
import org.Aayush.navigation.data.FormMethod;
import org.Aayush.navigation.data.Submission;
import org.Aayush.navigation.graph.DataRoute;
import org.Aayush.navigation.graph.RouteGraph;
import org.Aayush.navigation.matching.RouteMatch;
import org.Aayush.navigation.matching.RouteMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Turns navigate and fetch arguments into paths, submissions and target matches.
 */
@UtilityClass
final class NavigationRequests {
    private static final Logger log = LoggerFactory.getLogger(NavigationRequests.class);

    static final String NOT_FOUND_ROUTE_ID = "__shim-404-route__";
    private static final String INDEX_PARAM = "index";

    /**
     * Normalized navigate arguments.
     *
     * @param path target URL path, with GET form data folded into its search string.
     * @param submission mutation to submit, or null.
     * @param error form serialization failure to show at the nearest boundary, or null.
     */
    record NormalizedNavigation(String path, Submission submission, ErrorResponse error) {
    }

    /**
     * Synthesized match chain for a location that matched nothing.
     */
    record ShortCircuit(List<RouteMatch> matches, DataRoute route, ErrorResponse error) {
    }

    static NormalizedNavigation normalizeNavigateOptions(String to, NavigateOptions options, boolean isFetcher) {
        String path = to;
        if (options == null || options.getFormData() == null) {
            return new NormalizedNavigation(path, null, null);
        }

        FormMethod formMethod = options.getFormMethod();
        if (formMethod != null && formMethod.isMutation()) {
            Submission submission = Submission.builder()
                    .formMethod(formMethod)
                    .formAction(Path.parse(path).withoutHash().toHref())
                    .formEncType(options.getFormEncType() != null ? options.getFormEncType() : FormEncType.URL_ENCODED)
                    .formData(options.getFormData())
                    .build();
            return new NormalizedNavigation(path, submission, null);
        }

        Path parsedPath = Path.parse(path);
        FormData formData = options.getFormData();
        if (formData.hasBinary()) {
            return new NormalizedNavigation(
                    path,
                    null,
                    new ErrorResponse(400, "Bad Request", "Cannot submit binary form data using GET")
            );
        }
        String searchParams = formData.toSearchParams();
        if (isFetcher && !parsedPath.search().isEmpty() && hasNakedIndexQuery(parsedPath.search())) {
            searchParams = searchParams.isEmpty() ? INDEX_PARAM + "=" : searchParams + "&" + INDEX_PARAM + "=";
        }
        return new NormalizedNavigation(parsedPath.withSearch("?" + searchParams).toHref(), null, null);
    }

    /**
     * True when {@code search} carries an {@code index} param without a value.
     */
    static boolean hasNakedIndexQuery(String search) {
        if (search == null || search.isEmpty()) {
            return false;
        }
        String query = search.charAt(0) == '?' ? search.substring(1) : search;
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int separator = pair.indexOf('=');
            String name = separator >= 0 ? pair.substring(0, separator) : pair;
            String value = separator >= 0 ? pair.substring(separator + 1) : "";
            if (value.isEmpty() && INDEX_PARAM.equals(decodeParamName(name))) {
                return true;
            }
        }
        return false;
    }

    private static String decodeParamName(String name) {
        try {
            return URLDecoder.decode(name, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Malformed escapes keep the raw name.
            return name;
        }
    }

    /**
     * Match whose action or loader a submission or fetch targets.
     *
     * <p>A leaf index route is targeted only when asked for with {@code ?index};
     * otherwise the deepest match that owns a path segment is.</p>
     */
    static RouteMatch getTargetMatch(List<RouteMatch> matches, String search) {
        RouteMatch leaf = matches.get(matches.size() - 1);
        if (leaf.getRoute().isIndex() && hasNakedIndexQuery(search)) {
            return leaf;
        }
        List<RouteMatch> pathMatches = RouteMatcher.getPathContributingMatches(matches);
        return pathMatches.get(pathMatches.size() - 1);
    }

    /**
     * Builds the single-match chain that carries a 404 for an unmatched location.
     *
     * <p>Uses the first root that is an index route, is pathless or has path {@code /};
     * a placeholder route stands in when there is none.</p>
     */
    static ShortCircuit getNotFoundMatches(RouteGraph graph) {
        DataRoute route = null;
        for (DataRoute root : graph.roots()) {
            if (root.isIndex() || root.getPath() == null || root.getPath().isEmpty() || "/".equals(root.getPath())) {
                route = root;
                break;
            }
        }
        if (route == null) {
            route = DataRoute.builder()
                    .id(NOT_FOUND_ROUTE_ID)
                    .childIds(List.of())
                    .treePath(new IntArrayList())
                    .build();
        }
        RouteMatch match = new RouteMatch(Map.of(), "", "", route);
        return new ShortCircuit(List.of(match), route, new ErrorResponse(404, "Not Found", null));
    }

    /**
     * 405 error for a submission to a route without an action.
     */
    static ErrorResponse methodNotAllowed(String href) {
        log.warn("Submission to a route without an action; add an action to the route for [{}]", href);
        return new ErrorResponse(405, "Method Not Allowed", "");
    }
}
