package org.Aayush.navigation.router;

import lombok.experimental.UtilityClass;
import org.Aayush.navigation.core.history.Location;
import org.Aayush.navigation.core.history.Path;
import org.Aayush.navigation.data.RevalidationPredicate;
import org.Aayush.navigation.data.ShouldRevalidateArgs;
import org.Aayush.navigation.data.Submission;
import org.Aayush.navigation.matching.PathMatcher;
import org.Aayush.navigation.matching.RouteMatch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides which matched loaders and which fetchers run during a loader round.
 */
@UtilityClass
final class RevalidationPolicy {

    /**
     * Last load of a fetcher, replayed when the fetcher revalidates.
     */
    record FetchLoadMatch(String path, RouteMatch match, List<RouteMatch> matches) {
    }

    /**
     * Fetcher reloaded alongside a loader round.
     */
    record RevalidatingFetcher(String key, String href, RouteMatch match, List<RouteMatch> matches) {
    }

    record MatchesToLoad(List<RouteMatch> navigationMatches, List<RevalidatingFetcher> revalidatingFetchers) {
        boolean isEmpty() {
            return navigationMatches.isEmpty() && revalidatingFetchers.isEmpty();
        }
    }

    /**
     * Selects the loaders to call for {@code matches}.
     *
     * <p>With a pending error only matches above the error's boundary are considered.
     * A loader runs when its route is new or lacks data, when its deferred data was
     * just cancelled, or when the revalidation decision says so. Fetchers whose load was
     * interrupted always reload; other fetchers reload only when revalidation is required.</p>
     */
    static MatchesToLoad getMatchesToLoad(
            RouterState state,
            List<RouteMatch> matches,
            Submission submission,
            Location location,
            boolean isRevalidationRequired,
            Collection<String> cancelledDeferredRoutes,
            Collection<String> cancelledFetcherLoads,
            RouteValue pendingActionData,
            RouteValue pendingError,
            Map<String, FetchLoadMatch> fetchLoadMatches
    ) {
        Object actionResult = pendingError != null
                ? pendingError.value()
                : pendingActionData != null ? pendingActionData.value() : null;

        List<RouteMatch> boundaryMatches =
                getLoaderMatchesUntilBoundary(matches, pendingError != null ? pendingError.routeId() : null);

        Path currentUrl = state.getLocation().toPath();
        Path nextUrl = location.toPath();
        List<RouteMatch> currentMatches = state.getMatches();
        List<RouteMatch> navigationMatches = new ArrayList<>();
        for (int index = 0; index < boundaryMatches.size(); index++) {
            RouteMatch match = boundaryMatches.get(index);
            if (!match.getRoute().hasLoader()) {
                continue;
            }
            RouteMatch currentMatch = index < currentMatches.size() ? currentMatches.get(index) : null;
            if (isNewLoader(state.getLoaderData(), currentMatch, match)
                    || cancelledDeferredRoutes.contains(match.routeId())
                    || shouldRevalidateLoader(currentUrl, currentMatch, submission, nextUrl, match,
                    isRevalidationRequired, actionResult)) {
                navigationMatches.add(match);
            }
        }

        List<RevalidatingFetcher> revalidatingFetchers = new ArrayList<>();
        for (Map.Entry<String, FetchLoadMatch> entry : fetchLoadMatches.entrySet()) {
            String key = entry.getKey();
            FetchLoadMatch load = entry.getValue();
            RevalidatingFetcher fetcher = new RevalidatingFetcher(key, load.path(), load.match(), load.matches());
            if (cancelledFetcherLoads.contains(key)) {
                revalidatingFetchers.add(fetcher);
            } else if (isRevalidationRequired) {
                Path href = Path.parse(load.path());
                if (shouldRevalidateLoader(href, load.match(), submission, href, load.match(),
                        true, actionResult)) {
                    revalidatingFetchers.add(fetcher);
                }
            }
        }
        return new MatchesToLoad(navigationMatches, revalidatingFetchers);
    }

    /**
     * Matches above the boundary {@code boundaryId}, excluding it; all matches when
     * there is no boundary or it is not matched.
     */
    static List<RouteMatch> getLoaderMatchesUntilBoundary(List<RouteMatch> matches, String boundaryId) {
        if (boundaryId == null) {
            return matches;
        }
        int boundaryIndex = indexOfRoute(matches, boundaryId);
        return boundaryIndex >= 0 ? matches.subList(0, boundaryIndex) : matches;
    }

    /**
     * True when the route was not at this position before or has no data yet.
     */
    static boolean isNewLoader(Map<String, Object> currentLoaderData, RouteMatch currentMatch, RouteMatch match) {
        boolean isNew = currentMatch == null || !match.routeId().equals(currentMatch.routeId());
        boolean isMissingData = !currentLoaderData.containsKey(match.routeId());
        return isNew || isMissingData;
    }

    /**
     * True when the matched pathname or the splat capture of a splat route changed.
     */
    static boolean isNewRouteInstance(RouteMatch currentMatch, RouteMatch match) {
        String currentPath = currentMatch.getRoute().getPath();
        return !currentMatch.getPathname().equals(match.getPathname())
                || (currentPath != null
                && currentPath.endsWith(PathMatcher.SPLAT)
                && !Objects.equals(currentMatch.getParams().get(PathMatcher.SPLAT), match.getParams().get(PathMatcher.SPLAT)));
    }

    /**
     * Applies the route's predicate, or the default decision when it has none.
     */
    static boolean shouldRevalidateLoader(
            Path currentUrl,
            RouteMatch currentMatch,
            Submission submission,
            Path nextUrl,
            RouteMatch match,
            boolean isRevalidationRequired,
            Object actionResult
    ) {
        boolean defaultShouldRevalidate = isNewRouteInstance(currentMatch, match)
                || currentUrl.toHref().equals(nextUrl.toHref())
                || !currentUrl.search().equals(nextUrl.search())
                || isRevalidationRequired;

        RevalidationPredicate predicate = match.getRoute().getShouldRevalidate();
        if (predicate == null) {
            return defaultShouldRevalidate;
        }
        ShouldRevalidateArgs.ShouldRevalidateArgsBuilder args = ShouldRevalidateArgs.builder()
                .currentUrl(currentUrl)
                .currentParams(currentMatch.getParams())
                .nextUrl(nextUrl)
                .nextParams(match.getParams())
                .actionResult(actionResult)
                .defaultShouldRevalidate(defaultShouldRevalidate);
        if (submission != null) {
            args.formMethod(submission.getFormMethod())
                    .formAction(submission.getFormAction())
                    .formEncType(submission.getFormEncType())
                    .formData(submission.getFormData());
        }
        return predicate.shouldRevalidate(args.build());
    }

    static int indexOfRoute(List<RouteMatch> matches, String routeId) {
        for (int i = 0; i < matches.size(); i++) {
            if (matches.get(i).routeId().equals(routeId)) {
                return i;
            }
        }
        return -1;
    }

    static boolean containsRoute(List<RouteMatch> matches, String routeId) {
        return indexOfRoute(matches, routeId) >= 0;
    }
}
