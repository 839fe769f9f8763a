package org.Aayush.navigation.matching;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.experimental.UtilityClass;
import org.Aayush.navigation.core.path.PathUtils;
import org.Aayush.navigation.graph.DataRoute;
import org.Aayush.navigation.graph.RouteConfigurationException;
import org.Aayush.navigation.graph.RouteGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flattens a route graph into scored branches and ranks them.
 *
 * <p>Score = segment count, -2 when any segment is a bare {@code *}, +2 for index
 * routes, then +10 per static, +3 per {@code :name} and +1 per empty segment
 * (splat segments add nothing).</p>
 */
@UtilityClass
public final class BranchRanker {
    static final int DYNAMIC_SEGMENT_VALUE = 3;
    static final int INDEX_ROUTE_VALUE = 2;
    static final int EMPTY_SEGMENT_VALUE = 1;
    static final int STATIC_SEGMENT_VALUE = 10;
    static final int SPLAT_PENALTY = -2;

    private static final Pattern PARAM_SEGMENT = Pattern.compile("^:\\w+\\z");

    /**
     * Orders branches by descending score, then siblings by child index.
     * The sort is stable, so other ties keep flattening order.
     */
    public static final Comparator<RouteBranch> RANK_ORDER = (a, b) -> a.score() != b.score()
            ? Integer.compare(b.score(), a.score())
            : compareIndexes(a.childrenIndexes(), b.childrenIndexes());

    /**
     * Flattens and ranks every branch of {@code graph}.
     */
    public static List<RouteBranch> rankedBranches(RouteGraph graph) {
        List<RouteBranch> branches = flattenRoutes(graph);
        rankRouteBranches(branches);
        return branches;
    }

    /**
     * Flattens the graph depth-first, emitting children before their parent.
     *
     * <p>Layout routes (no path, not index) contribute to descendants' paths only.</p>
     *
     * @throws RouteConfigurationException when an absolute child path does not start
     *                                     with the joined path of its parents.
     */
    public static List<RouteBranch> flattenRoutes(RouteGraph graph) {
        List<RouteBranch> branches = new ArrayList<>();
        flatten(graph, graph.roots(), branches, List.of(), "");
        return branches;
    }

    private static void flatten(
            RouteGraph graph,
            List<DataRoute> routes,
            List<RouteBranch> branches,
            List<RouteMeta> parentsMeta,
            String parentPath
    ) {
        for (int index = 0; index < routes.size(); index++) {
            DataRoute route = routes.get(index);
            String relativePath = route.getPath() == null ? "" : route.getPath();
            if (relativePath.startsWith("/")) {
                if (!relativePath.startsWith(parentPath)) {
                    throw new RouteConfigurationException(
                            RouteConfigurationException.REASON_INVALID_ABSOLUTE_PATH,
                            "Absolute route path \"" + relativePath + "\" nested under path \"" + parentPath
                                    + "\" is not valid. An absolute child route path must start with the "
                                    + "combined path of all its parent routes."
                    );
                }
                relativePath = relativePath.substring(parentPath.length());
            }

            RouteMeta meta = new RouteMeta(relativePath, route.isCaseSensitive(), index, route);
            String path = PathUtils.joinPaths(parentPath, relativePath);
            List<RouteMeta> routesMeta = new ArrayList<>(parentsMeta.size() + 1);
            routesMeta.addAll(parentsMeta);
            routesMeta.add(meta);

            if (route.hasChildren()) {
                flatten(graph, graph.children(route), branches, routesMeta, path);
            }
            if (route.getPath() == null && !route.isIndex()) {
                continue;
            }
            branches.add(new RouteBranch(path, computeScore(path, route.isIndex()), routesMeta));
        }
    }

    /**
     * Sorts {@code branches} in place by {@link #RANK_ORDER}.
     *
     * <p>Uses a plain stable merge sort: the order is not transitive across
     * non-siblings, which {@link List#sort} may reject.</p>
     */
    public static void rankRouteBranches(List<RouteBranch> branches) {
        if (branches.size() < 2) {
            return;
        }
        RouteBranch[] sorted = branches.toArray(new RouteBranch[0]);
        mergeSort(sorted, new RouteBranch[sorted.length], 0, sorted.length);
        for (int i = 0; i < sorted.length; i++) {
            branches.set(i, sorted[i]);
        }
    }

    private static void mergeSort(RouteBranch[] items, RouteBranch[] scratch, int from, int to) {
        if (to - from < 2) {
            return;
        }
        int mid = (from + to) >>> 1;
        mergeSort(items, scratch, from, mid);
        mergeSort(items, scratch, mid, to);
        System.arraycopy(items, from, scratch, from, to - from);
        int left = from;
        int right = mid;
        for (int i = from; i < to; i++) {
            if (right >= to || (left < mid && RANK_ORDER.compare(scratch[left], scratch[right]) <= 0)) {
                items[i] = scratch[left++];
            } else {
                items[i] = scratch[right++];
            }
        }
    }

    /**
     * Scores a joined branch path.
     */
    public static int computeScore(String path, boolean index) {
        String[] segments = path.split("/", -1);
        int score = segments.length;
        boolean hasSplat = false;
        for (String segment : segments) {
            if (PathMatcher.SPLAT.equals(segment)) {
                hasSplat = true;
                break;
            }
        }
        if (hasSplat) {
            score += SPLAT_PENALTY;
        }
        if (index) {
            score += INDEX_ROUTE_VALUE;
        }
        for (String segment : segments) {
            if (PathMatcher.SPLAT.equals(segment)) {
                continue;
            }
            if (PARAM_SEGMENT.matcher(segment).matches()) {
                score += DYNAMIC_SEGMENT_VALUE;
            } else if (segment.isEmpty()) {
                score += EMPTY_SEGMENT_VALUE;
            } else {
                score += STATIC_SEGMENT_VALUE;
            }
        }
        return score;
    }

    /**
     * Orders sibling branches by their last child index; non-siblings compare equal.
     */
    public static int compareIndexes(IntList a, IntList b) {
        boolean siblings = a.size() == b.size() && !a.isEmpty();
        for (int i = 0; siblings && i < a.size() - 1; i++) {
            siblings = a.getInt(i) == b.getInt(i);
        }
        return siblings ? Integer.compare(a.getInt(a.size() - 1), b.getInt(b.size() - 1)) : 0;
    }
}
