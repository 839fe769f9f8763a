package org.Aayush.navigation.router;

import lombok.Builder;
import lombok.Value;
import org.Aayush.navigation.core.history.HistoryAction;
import org.Aayush.navigation.core.history.Location;
import org.Aayush.navigation.matching.RouteMatch;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of everything the router knows.
 *
 * <p>Data maps are keyed by route id and may hold null values; a route is absent
 * from a map when it has no entry. An empty {@code actionData} or {@code errors}
 * map means there is none.</p>
 */
@Value
@Builder(toBuilder = true)
public class RouterState {
    /** Action of the last committed navigation. */
    HistoryAction historyAction;
    Location location;
    List<RouteMatch> matches;
    /** False until the first loader round finished (or hydration data was supplied). */
    boolean initialized;
    Navigation navigation;
    /** Saved scroll position to restore, or null. */
    Integer restoreScrollPosition;
    /** True after a submission: the rendering layer keeps the scroll position as is. */
    boolean scrollRestorationSuppressed;
    boolean preventScrollReset;
    RevalidationState revalidation;
    Map<String, Object> loaderData;
    Map<String, Object> actionData;
    Map<String, Object> errors;
    /** Status of the first committed error, else of the last non-200 loader response, else 200. */
    @Builder.Default
    int statusCode = 200;
    /** Response headers of the last loader round, by route id. */
    @Builder.Default
    Map<String, Map<String, String>> loaderHeaders = Map.of();
    Map<String, Fetcher> fetchers;

    /**
     * Returns the fetcher under {@code key}, or {@link Fetcher#IDLE}.
     */
    public Fetcher fetcher(String key) {
        Fetcher fetcher = fetchers.get(key);
        return fetcher == null ? Fetcher.IDLE : fetcher;
    }
}
