package org.Aayush.navigation.router;

import org.Aayush.navigation.core.history.Location;
import org.Aayush.navigation.core.history.Path;
import org.Aayush.navigation.graph.RouteGraph;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Navigation engine: owns router state and drives navigations, submissions,
 * revalidations and keyed fetchers.
 *
 * <p>Asynchronous operations return futures that complete once the operation settled,
 * including every redirect it triggered. Loader and action failures never complete
 * these futures exceptionally; they are recorded in {@link RouterState#getErrors()}.</p>
 */
public interface Router {

    /**
     * Starts listening to history and runs the initial load when needed.
     */
    Router initialize();

    /**
     * Stops listening to history, drops subscribers and aborts in-flight work.
     */
    void dispose();

    /**
     * Registers a subscriber notified with every committed state.
     *
     * @return handle that unsubscribes.
     */
    Runnable subscribe(RouterSubscriber subscriber);

    RouterState state();

    RouteGraph routes();

    String basename();

    /**
     * Moves through history by {@code delta} entries.
     */
    CompletableFuture<Void> navigate(int delta);

    CompletableFuture<Void> navigate(String to);

    CompletableFuture<Void> navigate(String to, NavigateOptions options);

    /**
     * Loads or submits to {@code href} under {@code key}, independently of navigation.
     *
     * @param key caller chosen fetcher key.
     * @param routeId route whose boundary receives errors.
     * @param href target URL.
     * @param options form fields; none for a plain load.
     */
    CompletableFuture<Void> fetch(String key, String routeId, String href, NavigateOptions options);

    /**
     * Re-runs the loaders of the current (or pending) location.
     */
    CompletableFuture<Void> revalidate();

    Fetcher getFetcher(String key);

    CompletableFuture<Void> deleteFetcher(String key);

    String createHref(Location location);

    String createHref(Path path);

    /**
     * Enables scroll position bookkeeping.
     *
     * @param savedPositions caller-owned map of restoration key to position.
     * @param scrollRestoration source of positions and keys.
     * @return handle that disables it again.
     */
    Runnable enableScrollRestoration(Map<String, Integer> savedPositions, ScrollRestoration scrollRestoration);
}
