package org.Aayush.navigation.matching;

import org.Aayush.navigation.core.history.Path;
import org.Aayush.navigation.core.path.PathUtils;
import org.Aayush.navigation.core.path.UriDecoding;
import org.Aayush.navigation.graph.RouteGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Matches URLs against the ranked branches of one route graph.
 *
 * <p>Branches and their compiled segment patterns are computed once at construction;
 * instances are immutable and safe to share.</p>
 */
public final class RouteMatcher {
    private final RouteGraph graph;
    private final List<CompiledBranch> branches;

    private record CompiledBranch(RouteBranch branch, List<PathPattern> patterns, List<CompiledPath> compiled) {
    }

    public RouteMatcher(RouteGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        List<CompiledBranch> compiledBranches = new ArrayList<>();
        for (RouteBranch branch : BranchRanker.rankedBranches(graph)) {
            List<RouteMeta> routesMeta = branch.routesMeta();
            List<PathPattern> patterns = new ArrayList<>(routesMeta.size());
            List<CompiledPath> compiled = new ArrayList<>(routesMeta.size());
            for (int i = 0; i < routesMeta.size(); i++) {
                RouteMeta meta = routesMeta.get(i);
                PathPattern pattern = PathPattern.builder()
                        .path(meta.relativePath())
                        .caseSensitive(meta.caseSensitive())
                        .end(i == routesMeta.size() - 1)
                        .build();
                patterns.add(pattern);
                compiled.add(PathMatcher.compilePath(pattern.getPath(), pattern.isCaseSensitive(), pattern.isEnd()));
            }
            compiledBranches.add(new CompiledBranch(branch, patterns, compiled));
        }
        this.branches = Collections.unmodifiableList(compiledBranches);
    }

    /**
     * One-shot convenience for {@link #matchRoutes(Path, String)}.
     */
    public static List<RouteMatch> matchRoutes(RouteGraph graph, String location, String basename) {
        return new RouteMatcher(graph).matchRoutes(Path.parse(location), basename);
    }

    public RouteGraph graph() {
        return graph;
    }

    /**
     * Ranked branches in the order they are tried.
     */
    public List<RouteBranch> branches() {
        List<RouteBranch> ranked = new ArrayList<>(branches.size());
        for (CompiledBranch compiledBranch : branches) {
            ranked.add(compiledBranch.branch());
        }
        return ranked;
    }

    /**
     * Matches {@code location} against the route graph.
     *
     * @param location location whose pathname is matched; search and hash are ignored.
     * @param basename prefix stripped before matching.
     * @return root-to-leaf matches of the first matching branch, or null.
     */
    public List<RouteMatch> matchRoutes(Path location, String basename) {
        String pathname = location.pathname().isEmpty() ? "/" : location.pathname();
        String stripped = PathUtils.stripBasename(pathname, basename == null ? "/" : basename);
        if (stripped == null) {
            return null;
        }
        String decoded = UriDecoding.safelyDecodeUri(stripped);
        for (CompiledBranch branch : branches) {
            List<RouteMatch> matches = matchRouteBranch(branch, decoded);
            if (matches != null) {
                return matches;
            }
        }
        return null;
    }

    public List<RouteMatch> matchRoutes(String location, String basename) {
        return matchRoutes(Path.parse(location), basename);
    }

    private static List<RouteMatch> matchRouteBranch(CompiledBranch branch, String pathname) {
        List<RouteMeta> routesMeta = branch.branch().routesMeta();
        Map<String, String> matchedParams = new LinkedHashMap<>();
        String matchedPathname = "/";
        List<String> pathnames = new ArrayList<>(routesMeta.size());
        List<String> pathnameBases = new ArrayList<>(routesMeta.size());

        for (int i = 0; i < routesMeta.size(); i++) {
            String remainingPathname;
            if ("/".equals(matchedPathname)) {
                remainingPathname = pathname;
            } else {
                remainingPathname = pathname.length() > matchedPathname.length()
                        ? pathname.substring(matchedPathname.length())
                        : "/";
            }
            PathMatch match = PathMatcher.matchPath(branch.patterns().get(i), branch.compiled().get(i), remainingPathname);
            if (match == null) {
                return null;
            }
            matchedParams.putAll(match.getParams());
            pathnames.add(PathUtils.joinPaths(matchedPathname, match.getPathname()));
            pathnameBases.add(PathUtils.normalizePathname(PathUtils.joinPaths(matchedPathname, match.getPathnameBase())));
            if (!"/".equals(match.getPathnameBase())) {
                matchedPathname = PathUtils.joinPaths(matchedPathname, match.getPathnameBase());
            }
        }

        Map<String, String> params = Collections.unmodifiableMap(matchedParams);
        List<RouteMatch> matches = new ArrayList<>(routesMeta.size());
        for (int i = 0; i < routesMeta.size(); i++) {
            matches.add(new RouteMatch(params, pathnames.get(i), pathnameBases.get(i), routesMeta.get(i).route()));
        }
        return Collections.unmodifiableList(matches);
    }

    /**
     * Matches that contribute a path segment: the root match plus every match whose
     * route declares a non-empty path.
     */
    public static List<RouteMatch> getPathContributingMatches(List<RouteMatch> matches) {
        List<RouteMatch> contributing = new ArrayList<>(matches.size());
        for (int i = 0; i < matches.size(); i++) {
            RouteMatch match = matches.get(i);
            String path = match.getRoute().getPath();
            if (i == 0 || (path != null && !path.isEmpty())) {
                contributing.add(match);
            }
        }
        return contributing;
    }
}
