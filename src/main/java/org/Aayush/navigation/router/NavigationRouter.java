package org.Aayush.navigation.router;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Builder;
import lombok.Value;
import org.Aayush.navigation.core.history.HistoryAction;
import org.Aayush.navigation.core.history.Location;
import org.Aayush.navigation.core.history.NavigationHistory;
import org.Aayush.navigation.core.history.Path;
import org.Aayush.navigation.core.signal.AbortController;
import org.Aayush.navigation.core.signal.AbortSignal;
import org.Aayush.navigation.data.DataRequest;
import org.Aayush.navigation.data.DataResult;
import org.Aayush.navigation.data.ErrorResponse;
import org.Aayush.navigation.data.Submission;
import org.Aayush.navigation.deferred.DeferredData;
import org.Aayush.navigation.graph.RouteConfigurationException;
import org.Aayush.navigation.graph.RouteGraph;
import org.Aayush.navigation.matching.RouteMatch;
import org.Aayush.navigation.matching.RouteMatcher;
import org.Aayush.navigation.router.DataFunctionInvoker.Kind;
import org.Aayush.navigation.router.LoaderResultProcessor.ProcessedData;
import org.Aayush.navigation.router.NavigationRequests.NormalizedNavigation;
import org.Aayush.navigation.router.NavigationRequests.ShortCircuit;
import org.Aayush.navigation.router.RevalidationPolicy.FetchLoadMatch;
import org.Aayush.navigation.router.RevalidationPolicy.MatchesToLoad;
import org.Aayush.navigation.router.RevalidationPolicy.RevalidatingFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Default {@link Router}: a navigation state machine confined to one router loop.
 *
 * <p>Every public entry point hops onto the loop and every continuation of a loader,
 * action or deferred value resumes there, so router fields are never touched by two
 * threads at once. State is only replaced through {@link #updateState}, which
 * publishes an immutable snapshot to all subscribers.</p>
 *
 * <p>Lifecycle: construct, {@link #initialize()}, use, {@link #dispose()}.</p>
 */
public final class NavigationRouter implements Router {
    private static final Logger log = LoggerFactory.getLogger(NavigationRouter.class);
    private static final String LOOP_THREAD_NAME = "navigation-router";

    /**
     * Options of one {@link #startNavigation} call.
     */
    @Value
    @Builder
    private static class StartOptions {
        static final StartOptions NONE = StartOptions.builder().build();

        Submission submission;
        /** Navigation published while loaders run, instead of a plain loading phase. */
        Navigation overrideNavigation;
        /** Form serialization failure recorded at the nearest boundary. */
        ErrorResponse pendingError;
        /** Revalidation of the current location that leaves history alone. */
        boolean startUninterruptedRevalidation;
        boolean preventScrollReset;
        boolean replace;
    }

    private record ActionOutput(boolean shortCircuited, RouteValue pendingActionData, RouteValue pendingActionError) {
        static final ActionOutput SHORT_CIRCUITED = new ActionOutput(true, null, null);
    }

    private record LoadedResults(List<DataResult> results, List<DataResult> loaderResults, List<DataResult> fetcherResults) {
    }

    private final RouteGraph graph;
    private final RouteMatcher matcher;
    private final NavigationHistory history;
    private final String basename;
    private final Executor loop;
    private final ExecutorService ownedLoop;
    private final DataFunctionInvoker invoker;
    private final Set<RouterSubscriber> subscribers = new CopyOnWriteArraySet<>();

    private volatile RouterState state;
    private volatile boolean disposed;

    // Loop-confined from here on.
    private final Map<String, Fetcher> fetchers = new LinkedHashMap<>();
    private Runnable unlistenHistory;

    private Map<String, Integer> savedScrollPositions;
    private ScrollRestoration scrollRestoration;
    private boolean initialScrollRestored;

    private HistoryAction pendingAction = HistoryAction.POP;
    private boolean pendingPreventScrollReset;
    private AbortController pendingNavigationController;
    private boolean isUninterruptedRevalidation;
    /** Forces every loader of the next loader round to run. */
    private boolean isRevalidationRequired;
    private List<String> cancelledDeferredRoutes = new ArrayList<>();
    private List<String> cancelledFetcherLoads = new ArrayList<>();

    private final Map<String, AbortController> fetchControllers = new HashMap<>();
    private int incrementingLoadId;
    private int pendingNavigationLoadId = -1;
    private final Object2IntMap<String> fetchReloadIds = new Object2IntOpenHashMap<>();
    private final Set<String> fetchRedirectIds = new LinkedHashSet<>();
    private final Map<String, FetchLoadMatch> fetchLoadMatches = new LinkedHashMap<>();
    private final Map<String, DeferredData> activeDeferreds = new LinkedHashMap<>();

    /**
     * Builds the route graph and the initial state for the current history location.
     *
     * @param init router configuration.
     * @throws RouteConfigurationException when the route tree is empty or invalid.
     */
    public NavigationRouter(RouterInit init) {
        Objects.requireNonNull(init, "init");
        if (init.getRoutes().isEmpty()) {
            throw new RouteConfigurationException(
                    RouteConfigurationException.REASON_EMPTY_ROUTES,
                    "a router needs at least one route"
            );
        }
        this.graph = RouteGraph.convertRoutesToDataRoutes(init.getRoutes());
        this.matcher = new RouteMatcher(graph);
        this.history = init.getHistory();
        this.basename = init.getBasename();
        if (init.getExecutor() != null) {
            this.ownedLoop = null;
            this.loop = init.getExecutor();
        } else {
            this.ownedLoop = Executors.newSingleThreadExecutor(task -> {
                Thread thread = new Thread(task, LOOP_THREAD_NAME);
                thread.setDaemon(true);
                return thread;
            });
            this.loop = ownedLoop;
        }
        this.invoker = new DataFunctionInvoker(loop, basename, init.getOrigin(), init.getJsonCodec());
        this.state = initialState(init.getHydrationData());
    }

    private RouterState initialState(HydrationState hydration) {
        Location location = history.location();
        List<RouteMatch> initialMatches = matcher.matchRoutes(location.toPath(), basename);
        Map<String, Object> initialErrors = Map.of();
        int initialStatus = LoaderResultProcessor.OK;
        if (initialMatches == null) {
            ShortCircuit notFound = NavigationRequests.getNotFoundMatches(graph);
            initialMatches = notFound.matches();
            initialErrors = Map.of(notFound.route().getId(), notFound.error());
            initialStatus = notFound.error().getStatus();
        }
        boolean initialized = hydration != null
                || initialMatches.stream().noneMatch(match -> match.getRoute().hasLoader());

        Map<String, Object> errors = initialErrors;
        if (hydration != null && !hydration.getErrors().isEmpty()) {
            errors = freeze(hydration.getErrors());
        }
        return RouterState.builder()
                .historyAction(history.action())
                .location(location)
                .matches(initialMatches)
                .initialized(initialized)
                .navigation(Navigation.IDLE)
                .revalidation(RevalidationState.IDLE)
                .loaderData(hydration != null ? freeze(hydration.getLoaderData()) : Map.of())
                .actionData(hydration != null ? freeze(hydration.getActionData()) : Map.of())
                .errors(errors)
                .statusCode(initialStatus)
                .fetchers(Map.of())
                .build();
    }

    // ------------------------------------------------------------------
    // Public surface
    // ------------------------------------------------------------------

    @Override
    public Router initialize() {
        runOnLoop(() -> {
            unlistenHistory = history.listen(update -> runOnLoop(() -> logFailure(
                    startNavigation(update.action(), update.location(), StartOptions.NONE),
                    "history navigation"
            )));
            if (!state.isInitialized()) {
                logFailure(startNavigation(HistoryAction.POP, state.getLocation(), StartOptions.NONE), "initial load");
            }
        });
        return this;
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        runOnLoop(() -> {
            if (unlistenHistory != null) {
                unlistenHistory.run();
                unlistenHistory = null;
            }
            subscribers.clear();
            if (pendingNavigationController != null) {
                pendingNavigationController.abort();
            }
            for (String key : new ArrayList<>(fetchers.keySet())) {
                removeFetcher(key);
            }
            cancelActiveDeferreds(null);
            log.debug("Router disposed");
        });
        if (ownedLoop != null) {
            ownedLoop.shutdown();
        }
    }

    @Override
    public Runnable subscribe(RouterSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    @Override
    public RouterState state() {
        return state;
    }

    @Override
    public RouteGraph routes() {
        return graph;
    }

    @Override
    public String basename() {
        return basename;
    }

    @Override
    public CompletableFuture<Void> navigate(int delta) {
        return onLoop(() -> {
            history.go(delta);
            return done();
        });
    }

    @Override
    public CompletableFuture<Void> navigate(String to) {
        return navigate(to, NavigateOptions.NONE);
    }

    @Override
    public CompletableFuture<Void> navigate(String to, NavigateOptions options) {
        Objects.requireNonNull(to, "to");
        NavigateOptions opts = options == null ? NavigateOptions.NONE : options;
        return onLoop(() -> {
            NormalizedNavigation normalized = NavigationRequests.normalizeNavigateOptions(to, opts, false);
            Location location = history.encodeLocation(
                    Location.create(state.getLocation().getPathname(), normalized.path(), opts.getState())
            );
            HistoryAction historyAction = opts.isReplace() || normalized.submission() != null
                    ? HistoryAction.REPLACE
                    : HistoryAction.PUSH;
            return startNavigation(historyAction, location, StartOptions.builder()
                    .submission(normalized.submission())
                    .pendingError(normalized.error())
                    .preventScrollReset(Boolean.TRUE.equals(opts.getPreventScrollReset()))
                    .replace(opts.isReplace())
                    .build());
        });
    }

    @Override
    public CompletableFuture<Void> fetch(String key, String routeId, String href, NavigateOptions options) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(routeId, "routeId");
        Objects.requireNonNull(href, "href");
        NavigateOptions opts = options == null ? NavigateOptions.NONE : options;
        return onLoop(() -> {
            if (fetchControllers.containsKey(key)) {
                abortFetcher(key);
            }

            List<RouteMatch> matches = matcher.matchRoutes(href, basename);
            if (matches == null) {
                setFetcherError(key, routeId, new ErrorResponse(404, "Not Found", null));
                return done();
            }

            NormalizedNavigation normalized = NavigationRequests.normalizeNavigateOptions(href, opts, true);
            if (normalized.error() != null) {
                setFetcherError(key, routeId, normalized.error());
                return done();
            }
            String path = normalized.path();
            RouteMatch match = NavigationRequests.getTargetMatch(matches, Path.parse(path).search());

            if (normalized.submission() != null) {
                return handleFetcherAction(key, routeId, path, match, matches, normalized.submission());
            }
            fetchLoadMatches.put(key, new FetchLoadMatch(path, match, matches));
            return handleFetcherLoader(key, routeId, path, match, matches);
        });
    }

    /**
     * {@inheritDoc}
     *
     * <p>While a submission is in flight the returned future completes immediately; the
     * submission's own loader round then reloads everything.</p>
     */
    @Override
    public CompletableFuture<Void> revalidate() {
        return onLoop(() -> {
            interruptActiveLoads();
            updateState(builder -> builder.revalidation(RevalidationState.LOADING));

            Navigation navigation = state.getNavigation();
            if (navigation.getState() == Navigation.State.SUBMITTING) {
                return done();
            }
            if (navigation.getState() == Navigation.State.IDLE) {
                return startNavigation(state.getHistoryAction(), state.getLocation(), StartOptions.builder()
                        .startUninterruptedRevalidation(true)
                        .build());
            }
            return startNavigation(pendingAction, navigation.getLocation(), StartOptions.builder()
                    .overrideNavigation(navigation)
                    .build());
        });
    }

    @Override
    public Fetcher getFetcher(String key) {
        return state.fetcher(key);
    }

    @Override
    public CompletableFuture<Void> deleteFetcher(String key) {
        Objects.requireNonNull(key, "key");
        return onLoop(() -> {
            removeFetcher(key);
            publishFetchers();
            return done();
        });
    }

    @Override
    public String createHref(Location location) {
        return history.createHref(location.toPath());
    }

    @Override
    public String createHref(Path path) {
        return history.createHref(path);
    }

    @Override
    public Runnable enableScrollRestoration(Map<String, Integer> savedPositions, ScrollRestoration restoration) {
        Objects.requireNonNull(savedPositions, "savedPositions");
        Objects.requireNonNull(restoration, "restoration");
        runOnLoop(() -> {
            savedScrollPositions = savedPositions;
            scrollRestoration = restoration;
            if (!initialScrollRestored && state.getNavigation().isIdle()) {
                initialScrollRestored = true;
                Integer position = getSavedScrollPosition(state.getLocation(), state.getMatches());
                if (position != null) {
                    updateState(builder -> builder.restoreScrollPosition(position));
                }
            }
        });
        return () -> runOnLoop(() -> {
            savedScrollPositions = null;
            scrollRestoration = null;
        });
    }

    // ------------------------------------------------------------------
    // Navigations
    // ------------------------------------------------------------------

    private CompletableFuture<Void> startNavigation(HistoryAction historyAction, Location location, StartOptions opts) {
        if (pendingNavigationController != null) {
            pendingNavigationController.abort();
        }
        pendingNavigationController = null;
        pendingAction = historyAction;
        isUninterruptedRevalidation = opts.isStartUninterruptedRevalidation();
        saveScrollPosition(state.getLocation(), state.getMatches());
        pendingPreventScrollReset = opts.isPreventScrollReset();
        log.debug("Navigation {} to {} started", historyAction, location.toHref());

        List<RouteMatch> matches = matcher.matchRoutes(location.toPath(), basename);
        if (matches == null) {
            ShortCircuit notFound = NavigationRequests.getNotFoundMatches(graph);
            cancelActiveDeferreds(null);
            completeNavigation(
                    location,
                    notFound.matches(),
                    ProcessedData.ofErrors(Map.of(notFound.route().getId(), notFound.error()), notFound.error().getStatus()),
                    null
            );
            return done();
        }

        Submission submission = opts.getSubmission();
        if (submission == null && Path.isHashChangeOnly(state.getLocation().toPath(), location.toPath())) {
            completeNavigation(location, matches, null, null);
            return done();
        }

        AbortController controller = new AbortController();
        pendingNavigationController = controller;
        DataRequest request = invoker.createRequest(location.toPath(), controller.signal(), submission);

        if (opts.getPendingError() != null) {
            RouteValue pendingError = new RouteValue(
                    LoaderResultProcessor.findNearestBoundary(matches, null).routeId(),
                    opts.getPendingError()
            );
            return loadAndComplete(request, controller, location, matches, opts.getOverrideNavigation(),
                    null, opts.isReplace(), null, pendingError);
        }

        if (submission != null && submission.getFormMethod().isMutation()) {
            return handleAction(request, location, submission, matches, opts.isReplace()).thenCompose(output -> {
                if (output.shortCircuited()) {
                    return done();
                }
                DataRequest loaderRequest = invoker.createRequest(location.toPath(), controller.signal(), null);
                return loadAndComplete(loaderRequest, controller, location, matches, Navigation.loading(location, submission),
                        submission, opts.isReplace(), output.pendingActionData(), output.pendingActionError());
            });
        }

        return loadAndComplete(request, controller, location, matches, opts.getOverrideNavigation(),
                submission, opts.isReplace(), null, null);
    }

    private CompletableFuture<Void> loadAndComplete(
            DataRequest request,
            AbortController controller,
            Location location,
            List<RouteMatch> matches,
            Navigation overrideNavigation,
            Submission submission,
            boolean replace,
            RouteValue pendingActionData,
            RouteValue pendingError
    ) {
        return handleLoaders(request, controller, location, matches, overrideNavigation, submission, replace,
                pendingActionData, pendingError).thenAccept(output -> {
            if (output == null) {
                return;
            }
            pendingNavigationController = null;
            completeNavigation(location, matches, output, actionDataOf(pendingActionData, pendingError));
        });
    }

    /**
     * Calls the target action and decides how the navigation continues.
     */
    private CompletableFuture<ActionOutput> handleAction(
            DataRequest request,
            Location location,
            Submission submission,
            List<RouteMatch> matches,
            boolean replace
    ) {
        interruptActiveLoads();
        updateState(builder -> builder.navigation(Navigation.submitting(location, submission)));

        RouteMatch actionMatch = NavigationRequests.getTargetMatch(matches, location.getSearch());
        CompletableFuture<DataResult> call;
        if (!actionMatch.getRoute().hasAction()) {
            call = CompletableFuture.completedFuture(
                    DataResult.Error.of(NavigationRequests.methodNotAllowed(location.toHref())));
        } else {
            call = invoker.call(Kind.ACTION, request, actionMatch, matches);
        }

        return call.thenCompose(result -> {
            if (request.getSignal().isAborted()) {
                return CompletableFuture.completedFuture(ActionOutput.SHORT_CIRCUITED);
            }
            if (result instanceof DataResult.Redirect redirect) {
                Navigation redirectNavigation = Navigation.loading(createLocation(redirect.location()), submission);
                return startRedirectNavigation(redirect, redirectNavigation, replace)
                        .thenApply(ignored -> ActionOutput.SHORT_CIRCUITED);
            }
            if (result instanceof DataResult.Error error) {
                RouteMatch boundaryMatch = LoaderResultProcessor.findNearestBoundary(matches, actionMatch.routeId());
                if (!replace) {
                    pendingAction = HistoryAction.PUSH;
                }
                return CompletableFuture.completedFuture(
                        new ActionOutput(false, null, new RouteValue(boundaryMatch.routeId(), error.error())));
            }
            if (result instanceof DataResult.Deferred) {
                throw deferInAction();
            }
            Object data = ((DataResult.Success) result).data();
            return CompletableFuture.completedFuture(
                    new ActionOutput(false, new RouteValue(actionMatch.routeId(), data), null));
        });
    }

    /**
     * Runs the loader round of a navigation.
     *
     * @return loader data and errors to commit, or null when the navigation was
     * short-circuited (completed, redirected or interrupted).
     */
    private CompletableFuture<ProcessedData> handleLoaders(
            DataRequest request,
            AbortController controller,
            Location location,
            List<RouteMatch> matches,
            Navigation overrideNavigation,
            Submission submission,
            boolean replace,
            RouteValue pendingActionData,
            RouteValue pendingError
    ) {
        Navigation loadingNavigation = overrideNavigation != null ? overrideNavigation : Navigation.loading(location);
        Submission activeSubmission = submission != null ? submission : loadingNavigation.submission();

        MatchesToLoad toLoad = RevalidationPolicy.getMatchesToLoad(
                state,
                matches,
                activeSubmission,
                location,
                isRevalidationRequired,
                cancelledDeferredRoutes,
                cancelledFetcherLoads,
                pendingActionData,
                pendingError,
                fetchLoadMatches
        );

        cancelActiveDeferreds(routeId -> !RevalidationPolicy.containsRoute(matches, routeId)
                || RevalidationPolicy.containsRoute(toLoad.navigationMatches(), routeId));

        if (toLoad.isEmpty()) {
            completeNavigation(
                    location,
                    matches,
                    pendingError != null
                            ? ProcessedData.ofErrors(routeMap(pendingError), LoaderResultProcessor.statusOf(pendingError.value()))
                            : ProcessedData.ofErrors(Map.of(), LoaderResultProcessor.OK),
                    actionDataOf(pendingActionData, pendingError)
            );
            return CompletableFuture.completedFuture(null);
        }

        if (!isUninterruptedRevalidation) {
            for (RevalidatingFetcher fetcher : toLoad.revalidatingFetchers()) {
                fetchers.put(fetcher.key(), Fetcher.loading(fetcherData(fetcher.key())));
            }
            Map<String, Object> actionData = pendingActionData != null ? routeMap(pendingActionData) : state.getActionData();
            updateState(builder -> builder.navigation(loadingNavigation).actionData(actionData));
        }

        pendingNavigationLoadId = ++incrementingLoadId;
        for (RevalidatingFetcher fetcher : toLoad.revalidatingFetchers()) {
            fetchControllers.put(fetcher.key(), controller);
        }

        return callLoadersAndMaybeResolveData(
                state.getMatches(),
                matches,
                toLoad.navigationMatches(),
                toLoad.revalidatingFetchers(),
                request
        ).thenCompose(loaded -> {
            if (request.getSignal().isAborted()) {
                return CompletableFuture.completedFuture(null);
            }
            for (RevalidatingFetcher fetcher : toLoad.revalidatingFetchers()) {
                fetchControllers.remove(fetcher.key());
            }

            DataResult.Redirect redirect = LoaderResultProcessor.findRedirect(loaded.results());
            if (redirect != null) {
                return startRedirectNavigation(redirect, getLoaderRedirect(redirect), replace)
                        .thenApply(ignored -> (ProcessedData) null);
            }

            ProcessedData processed = LoaderResultProcessor.processLoaderData(
                    state.getMatches(),
                    matches,
                    toLoad.navigationMatches(),
                    loaded.loaderResults(),
                    pendingError,
                    toLoad.revalidatingFetchers(),
                    loaded.fetcherResults(),
                    activeDeferreds,
                    fetchers
            );
            trackActiveDeferreds();
            markFetchRedirectsDone();
            abortStaleFetchLoads(pendingNavigationLoadId);
            return CompletableFuture.completedFuture(processed);
        });
    }

    /**
     * Commits a settled navigation: idle navigation, new location and matches, then the
     * history update for the recorded action.
     *
     * @param output loader round to commit: its data is merged over reused routes and its
     *               errors, status and headers replace the current ones. Null keeps them all.
     * @param actionData action data to commit, or null for the default (kept only on an action reload).
     */
    private void completeNavigation(
            Location location,
            List<RouteMatch> matches,
            ProcessedData output,
            Map<String, Object> actionData
    ) {
        Navigation navigation = state.getNavigation();
        boolean isActionReload = !state.getActionData().isEmpty()
                && navigation.getFormMethod() != null
                && navigation.getState() == Navigation.State.LOADING
                && pathnameOf(navigation.getFormAction()).equals(location.getPathname());

        Map<String, Object> nextActionData;
        if (actionData != null) {
            nextActionData = freeze(actionData);
        } else {
            nextActionData = isActionReload ? state.getActionData() : Map.of();
        }
        Map<String, Object> nextLoaderData = output != null
                ? LoaderResultProcessor.mergeLoaderData(state.getLoaderData(), output.loaderData(), matches)
                : state.getLoaderData();
        boolean submitted = navigation.getFormData() != null;
        Integer restoreScrollPosition = submitted ? null : getSavedScrollPosition(location, matches);
        HistoryAction historyAction = pendingAction;
        boolean preventScrollReset = pendingPreventScrollReset;

        updateState(builder -> {
            builder.historyAction(historyAction)
                    .location(location)
                    .matches(matches)
                    .initialized(true)
                    .navigation(Navigation.IDLE)
                    .revalidation(RevalidationState.IDLE)
                    .restoreScrollPosition(restoreScrollPosition)
                    .scrollRestorationSuppressed(submitted)
                    .preventScrollReset(preventScrollReset)
                    .loaderData(nextLoaderData)
                    .actionData(nextActionData);
            if (output != null) {
                builder.errors(freeze(output.errors()))
                        .statusCode(output.statusCode())
                        .loaderHeaders(freeze(output.loaderHeaders()));
            }
        });

        if (!isUninterruptedRevalidation) {
            if (historyAction == HistoryAction.PUSH) {
                history.push(location.toPath(), location.getState());
            } else if (historyAction == HistoryAction.REPLACE) {
                history.replace(location.toPath(), location.getState());
            }
        }
        log.debug("Navigation {} to {} completed", historyAction, location.toHref());

        pendingAction = HistoryAction.POP;
        pendingPreventScrollReset = false;
        isUninterruptedRevalidation = false;
        isRevalidationRequired = false;
        cancelledDeferredRoutes = new ArrayList<>();
        cancelledFetcherLoads = new ArrayList<>();
    }

    /**
     * Follows a redirect with a fresh navigation; history stays untouched until that
     * navigation completes.
     */
    private CompletableFuture<Void> startRedirectNavigation(DataResult.Redirect redirect, Navigation navigation, boolean replace) {
        if (redirect.revalidate()) {
            isRevalidationRequired = true;
        }
        log.debug("Redirecting to {} ({})", redirect.location(), redirect.status());
        pendingNavigationController = null;
        HistoryAction redirectHistoryAction = replace ? HistoryAction.REPLACE : HistoryAction.PUSH;
        return startNavigation(redirectHistoryAction, navigation.getLocation(), StartOptions.builder()
                .overrideNavigation(navigation)
                .build());
    }

    private Navigation getLoaderRedirect(DataResult.Redirect redirect) {
        return Navigation.loading(createLocation(redirect.location()), state.getNavigation().submission());
    }

    // ------------------------------------------------------------------
    // Loader rounds and deferred data
    // ------------------------------------------------------------------

    private CompletableFuture<LoadedResults> callLoadersAndMaybeResolveData(
            List<RouteMatch> currentMatches,
            List<RouteMatch> matches,
            List<RouteMatch> matchesToLoad,
            List<RevalidatingFetcher> fetchersToLoad,
            DataRequest request
    ) {
        List<CompletableFuture<DataResult>> calls = new ArrayList<>(matchesToLoad.size() + fetchersToLoad.size());
        for (RouteMatch match : matchesToLoad) {
            calls.add(invoker.call(Kind.LOADER, request, match, matches));
        }
        for (RevalidatingFetcher fetcher : fetchersToLoad) {
            DataRequest fetchRequest = invoker.createRequest(Path.parse(fetcher.href()), request.getSignal(), null);
            calls.add(invoker.call(Kind.LOADER, fetchRequest, fetcher.match(), fetcher.matches()));
        }

        return CompletableFuture.allOf(calls.toArray(new CompletableFuture<?>[0])).thenCompose(ignored -> {
            List<DataResult> loaderResults = new ArrayList<>(matchesToLoad.size());
            List<DataResult> fetcherResults = new ArrayList<>(fetchersToLoad.size());
            for (int i = 0; i < calls.size(); i++) {
                (i < matchesToLoad.size() ? loaderResults : fetcherResults).add(calls.get(i).join());
            }
            List<RouteMatch> fetcherMatches = new ArrayList<>(fetchersToLoad.size());
            for (RevalidatingFetcher fetcher : fetchersToLoad) {
                fetcherMatches.add(fetcher.match());
            }

            CompletableFuture<Void> loaders = resolveDeferredResults(currentMatches, matchesToLoad, loaderResults,
                    request.getSignal(), false, state.getLoaderData());
            CompletableFuture<Void> fetches = resolveDeferredResults(currentMatches, fetcherMatches, fetcherResults,
                    request.getSignal(), true, null);
            return CompletableFuture.allOf(loaders, fetches).thenApplyAsync(resolved -> {
                List<DataResult> results = new ArrayList<>(loaderResults);
                results.addAll(fetcherResults);
                return new LoadedResults(results, loaderResults, fetcherResults);
            }, loop);
        });
    }

    /**
     * Waits out deferred results of revalidating loaders (and of every fetcher), one at a
     * time, replacing them in {@code results} with their settled data.
     */
    private CompletableFuture<Void> resolveDeferredResults(
            List<RouteMatch> currentMatches,
            List<RouteMatch> matchesToLoad,
            List<DataResult> results,
            AbortSignal signal,
            boolean isFetcher,
            Map<String, Object> currentLoaderData
    ) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int index = 0; index < results.size(); index++) {
            int resultIndex = index;
            RouteMatch match = matchesToLoad.get(index);
            if (!(results.get(index) instanceof DataResult.Deferred deferred)) {
                continue;
            }
            RouteMatch currentMatch = null;
            for (RouteMatch candidate : currentMatches) {
                if (candidate.routeId().equals(match.routeId())) {
                    currentMatch = candidate;
                    break;
                }
            }
            boolean isRevalidatingLoader = currentMatch != null
                    && !RevalidationPolicy.isNewRouteInstance(currentMatch, match)
                    && currentLoaderData != null
                    && currentLoaderData.containsKey(match.routeId());
            if (isFetcher || isRevalidatingLoader) {
                chain = chain
                        .thenCompose(ignored -> resolveDeferredData(deferred, signal, isFetcher))
                        .thenAccept(resolved -> {
                            if (resolved != null) {
                                results.set(resultIndex, resolved);
                            }
                        });
            }
        }
        return chain;
    }

    /**
     * Settles a deferred result into plain data.
     *
     * @param unwrap replace tracked values by their settled values, failing on the first rejection.
     * @return settled result on the loop, or null when the deferred was aborted.
     */
    private CompletableFuture<DataResult> resolveDeferredData(DataResult.Deferred result, AbortSignal signal, boolean unwrap) {
        DeferredData deferredData = result.deferredData();
        return deferredData.resolveData(signal).thenApplyAsync(aborted -> {
            if (aborted) {
                return null;
            }
            if (unwrap) {
                try {
                    return DataResult.Success.of(deferredData.unwrappedData());
                } catch (Exception e) {
                    return DataResult.Error.of(e);
                }
            }
            return DataResult.Success.of(deferredData.data());
        }, loop);
    }

    /**
     * Drops active deferreds once they settle or get aborted.
     */
    private void trackActiveDeferreds() {
        for (Map.Entry<String, DeferredData> entry : activeDeferreds.entrySet()) {
            String routeId = entry.getKey();
            DeferredData deferredData = entry.getValue();
            deferredData.subscribe(aborted -> runOnLoop(() -> {
                if ((aborted || deferredData.isDone()) && activeDeferreds.get(routeId) == deferredData) {
                    activeDeferreds.remove(routeId);
                }
            }));
        }
    }

    /**
     * Cancels the active deferreds whose route ids pass {@code predicate} (all when null).
     *
     * @return ids of the cancelled routes.
     */
    private List<String> cancelActiveDeferreds(Predicate<String> predicate) {
        List<String> cancelledRouteIds = new ArrayList<>();
        Iterator<Map.Entry<String, DeferredData>> iterator = activeDeferreds.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, DeferredData> entry = iterator.next();
            if (predicate == null || predicate.test(entry.getKey())) {
                iterator.remove();
                entry.getValue().cancel();
                cancelledRouteIds.add(entry.getKey());
            }
        }
        if (!cancelledRouteIds.isEmpty()) {
            log.debug("Cancelled deferred data of routes {}", cancelledRouteIds);
        }
        return cancelledRouteIds;
    }

    /**
     * Cancels in-flight deferreds and fetcher loads so the next loader round redoes them.
     */
    private void interruptActiveLoads() {
        isRevalidationRequired = true;
        cancelledDeferredRoutes.addAll(cancelActiveDeferreds(null));
        for (String key : new ArrayList<>(fetchLoadMatches.keySet())) {
            if (fetchControllers.containsKey(key)) {
                cancelledFetcherLoads.add(key);
                abortFetcher(key);
            }
        }
    }

    // ------------------------------------------------------------------
    // Fetchers
    // ------------------------------------------------------------------

    private CompletableFuture<Void> handleFetcherAction(
            String key,
            String routeId,
            String path,
            RouteMatch match,
            List<RouteMatch> requestMatches,
            Submission submission
    ) {
        interruptActiveLoads();
        fetchLoadMatches.remove(key);

        if (!match.getRoute().hasAction()) {
            setFetcherError(key, routeId, NavigationRequests.methodNotAllowed(path));
            return done();
        }

        fetchers.put(key, Fetcher.submitting(fetcherData(key), submission));
        publishFetchers();

        AbortController abortController = new AbortController();
        DataRequest fetchRequest = invoker.createRequest(Path.parse(path), abortController.signal(), submission);
        fetchControllers.put(key, abortController);
        log.debug("Fetcher {} submitting {} to {}", key, submission.getFormMethod(), path);

        return invoker.call(Kind.ACTION, fetchRequest, match, requestMatches).thenCompose(actionResult -> {
            if (fetchRequest.getSignal().isAborted()) {
                if (fetchControllers.get(key) == abortController) {
                    fetchControllers.remove(key);
                }
                return done();
            }

            if (actionResult instanceof DataResult.Redirect redirect) {
                fetchControllers.remove(key);
                fetchRedirectIds.add(key);
                fetchers.put(key, Fetcher.loading(null, submission));
                publishFetchers();
                Navigation redirectNavigation = Navigation.loading(createLocation(redirect.location()), submission);
                return startRedirectNavigation(redirect, redirectNavigation, false);
            }
            if (actionResult instanceof DataResult.Error error) {
                setFetcherError(key, routeId, error.error());
                return done();
            }
            if (actionResult instanceof DataResult.Deferred) {
                throw deferInAction();
            }

            Object actionData = ((DataResult.Success) actionResult).data();
            return revalidateAfterFetcherAction(key, match, submission, actionData, abortController);
        });
    }

    /**
     * Reloads the current (or pending) location after a successful fetcher action.
     */
    private CompletableFuture<Void> revalidateAfterFetcherAction(
            String key,
            RouteMatch match,
            Submission submission,
            Object actionData,
            AbortController abortController
    ) {
        Navigation navigation = state.getNavigation();
        Location nextLocation = navigation.getLocation() != null ? navigation.getLocation() : state.getLocation();
        DataRequest revalidationRequest = invoker.createRequest(nextLocation.toPath(), abortController.signal(), null);
        List<RouteMatch> matches = navigation.isIdle()
                ? state.getMatches()
                : matcher.matchRoutes(navigation.getLocation().toPath(), basename);
        if (matches == null) {
            throw new IllegalStateException("Didn't find any matches after fetcher action");
        }

        int loadId = ++incrementingLoadId;
        fetchReloadIds.put(key, loadId);
        fetchers.put(key, Fetcher.loading(actionData, submission));

        MatchesToLoad toLoad = RevalidationPolicy.getMatchesToLoad(
                state,
                matches,
                submission,
                nextLocation,
                isRevalidationRequired,
                cancelledDeferredRoutes,
                cancelledFetcherLoads,
                new RouteValue(match.routeId(), actionData),
                null,
                fetchLoadMatches
        );
        for (RevalidatingFetcher stale : toLoad.revalidatingFetchers()) {
            if (stale.key().equals(key)) {
                continue;
            }
            fetchers.put(stale.key(), Fetcher.loading(fetcherData(stale.key())));
            fetchControllers.put(stale.key(), abortController);
        }
        publishFetchers();

        return callLoadersAndMaybeResolveData(
                state.getMatches(),
                matches,
                toLoad.navigationMatches(),
                toLoad.revalidatingFetchers(),
                revalidationRequest
        ).thenCompose(loaded -> {
            if (abortController.signal().isAborted()) {
                return done();
            }
            fetchReloadIds.removeInt(key);
            fetchControllers.remove(key);
            for (RevalidatingFetcher fetcher : toLoad.revalidatingFetchers()) {
                fetchControllers.remove(fetcher.key());
            }

            DataResult.Redirect redirect = LoaderResultProcessor.findRedirect(loaded.results());
            if (redirect != null) {
                return startRedirectNavigation(redirect, getLoaderRedirect(redirect), false);
            }

            ProcessedData processed = LoaderResultProcessor.processLoaderData(
                    state.getMatches(),
                    state.getMatches(),
                    toLoad.navigationMatches(),
                    loaded.loaderResults(),
                    null,
                    toLoad.revalidatingFetchers(),
                    loaded.fetcherResults(),
                    activeDeferreds,
                    fetchers
            );
            fetchers.put(key, Fetcher.idle(actionData));
            abortStaleFetchLoads(loadId);
            log.debug("Fetcher {} revalidation landed (load {})", key, loadId);

            Navigation current = state.getNavigation();
            if (current.getState() == Navigation.State.LOADING && loadId > pendingNavigationLoadId) {
                if (pendingNavigationController != null) {
                    pendingNavigationController.abort();
                }
                completeNavigation(current.getLocation(), matches, processed, null);
            } else {
                Map<String, Object> loaderData =
                        LoaderResultProcessor.mergeLoaderData(state.getLoaderData(), processed.loaderData(), matches);
                updateState(builder -> builder.errors(freeze(processed.errors())).loaderData(loaderData));
                isRevalidationRequired = false;
            }
            return done();
        });
    }

    private CompletableFuture<Void> handleFetcherLoader(
            String key,
            String routeId,
            String path,
            RouteMatch match,
            List<RouteMatch> matches
    ) {
        fetchers.put(key, Fetcher.loading(fetcherData(key)));
        publishFetchers();

        AbortController abortController = new AbortController();
        DataRequest fetchRequest = invoker.createRequest(Path.parse(path), abortController.signal(), null);
        fetchControllers.put(key, abortController);
        log.debug("Fetcher {} loading {}", key, path);

        return invoker.call(Kind.LOADER, fetchRequest, match, matches).thenCompose(result -> {
            if (result instanceof DataResult.Deferred deferred) {
                return resolveDeferredData(deferred, fetchRequest.getSignal(), true)
                        .thenApply(resolved -> resolved != null ? resolved : result);
            }
            return CompletableFuture.completedFuture(result);
        }).thenCompose(result -> {
            if (fetchControllers.get(key) == abortController) {
                fetchControllers.remove(key);
            }
            if (fetchRequest.getSignal().isAborted()) {
                log.debug("Fetcher {} load of {} aborted", key, path);
                return done();
            }

            if (result instanceof DataResult.Redirect redirect) {
                return startRedirectNavigation(redirect, getLoaderRedirect(redirect), false);
            }
            if (result instanceof DataResult.Error error) {
                RouteMatch boundaryMatch = LoaderResultProcessor.findNearestBoundary(state.getMatches(), routeId);
                fetchers.remove(key);
                updateState(builder -> builder.errors(routeMap(new RouteValue(boundaryMatch.routeId(), error.error()))));
                return done();
            }
            if (result instanceof DataResult.Deferred) {
                throw new IllegalStateException("Unhandled fetcher deferred data");
            }

            fetchers.put(key, Fetcher.idle(((DataResult.Success) result).data()));
            publishFetchers();
            return done();
        });
    }

    private void setFetcherError(String key, String routeId, Object error) {
        RouteMatch boundaryMatch = LoaderResultProcessor.findNearestBoundary(state.getMatches(), routeId);
        removeFetcher(key);
        log.debug("Fetcher {} failed; error recorded at route {}", key, boundaryMatch.routeId());
        updateState(builder -> builder.errors(routeMap(new RouteValue(boundaryMatch.routeId(), error))));
    }

    private void removeFetcher(String key) {
        if (fetchControllers.containsKey(key)) {
            abortFetcher(key);
        }
        fetchLoadMatches.remove(key);
        fetchReloadIds.removeInt(key);
        fetchRedirectIds.remove(key);
        fetchers.remove(key);
    }

    private void abortFetcher(String key) {
        AbortController controller = fetchControllers.remove(key);
        if (controller == null) {
            throw new RouterException(
                    RouterException.REASON_UNKNOWN_FETCHER_CONTROLLER,
                    "Expected fetch controller: " + key
            );
        }
        controller.abort();
    }

    private void markFetchersDone(List<String> keys) {
        for (String key : keys) {
            fetchers.put(key, Fetcher.idle(fetcherData(key)));
        }
    }

    private void markFetchRedirectsDone() {
        List<String> doneKeys = new ArrayList<>();
        Iterator<String> iterator = fetchRedirectIds.iterator();
        while (iterator.hasNext()) {
            String key = iterator.next();
            Fetcher fetcher = requireFetcher(key);
            if (fetcher.getState() == Fetcher.State.LOADING) {
                iterator.remove();
                doneKeys.add(key);
            }
        }
        markFetchersDone(doneKeys);
    }

    /**
     * Aborts fetcher reloads older than {@code landedId} that are still loading.
     *
     * @return true when any fetcher was aborted.
     */
    private boolean abortStaleFetchLoads(int landedId) {
        List<String> staleKeys = new ArrayList<>();
        for (String key : new ArrayList<>(fetchReloadIds.keySet())) {
            if (fetchReloadIds.getInt(key) >= landedId) {
                continue;
            }
            if (requireFetcher(key).getState() == Fetcher.State.LOADING) {
                abortFetcher(key);
                fetchReloadIds.removeInt(key);
                staleKeys.add(key);
            }
        }
        markFetchersDone(staleKeys);
        return !staleKeys.isEmpty();
    }

    private Fetcher requireFetcher(String key) {
        Fetcher fetcher = fetchers.get(key);
        if (fetcher == null) {
            throw new IllegalStateException("Expected fetcher: " + key);
        }
        return fetcher;
    }

    private Object fetcherData(String key) {
        Fetcher fetcher = fetchers.get(key);
        return fetcher == null ? null : fetcher.getData();
    }

    // ------------------------------------------------------------------
    // Scroll restoration
    // ------------------------------------------------------------------

    private void saveScrollPosition(Location location, List<RouteMatch> matches) {
        if (savedScrollPositions != null && scrollRestoration != null) {
            savedScrollPositions.put(restorationKey(location, matches), scrollRestoration.currentScrollPosition());
        }
    }

    private Integer getSavedScrollPosition(Location location, List<RouteMatch> matches) {
        if (savedScrollPositions != null && scrollRestoration != null) {
            return savedScrollPositions.get(restorationKey(location, matches));
        }
        return null;
    }

    private String restorationKey(Location location, List<RouteMatch> matches) {
        String key = scrollRestoration.restorationKey(location, matches);
        return key != null ? key : location.getKey();
    }

    // ------------------------------------------------------------------
    // State and loop plumbing
    // ------------------------------------------------------------------

    /**
     * Replaces the state with a copy carrying {@code changes} and the current fetchers,
     * then notifies every subscriber.
     */
    private void updateState(Consumer<RouterState.RouterStateBuilder> changes) {
        RouterState.RouterStateBuilder builder = state.toBuilder();
        changes.accept(builder);
        builder.fetchers(Collections.unmodifiableMap(new LinkedHashMap<>(fetchers)));
        RouterState next = builder.build();
        state = next;
        for (RouterSubscriber subscriber : subscribers) {
            try {
                subscriber.onStateChange(next);
            } catch (RuntimeException e) {
                log.warn("Router subscriber {} failed", subscriber, e);
            }
        }
    }

    private void publishFetchers() {
        updateState(builder -> {
        });
    }

    private Location createLocation(String to) {
        return Location.create(state.getLocation().getPathname(), to, null);
    }

    /**
     * Runs {@code task} on the loop and mirrors the future it returns.
     */
    private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (disposed) {
            result.completeExceptionally(disposedFailure(null));
            return result;
        }
        try {
            loop.execute(() -> {
                try {
                    task.get().whenComplete((value, failure) -> {
                        if (failure != null) {
                            result.completeExceptionally(failure);
                        } else {
                            result.complete(value);
                        }
                    });
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(disposedFailure(e));
        }
        return result;
    }

    private void runOnLoop(Runnable task) {
        try {
            loop.execute(() -> {
                try {
                    task.run();
                } catch (Throwable t) {
                    log.error("Router loop task failed", t);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Router loop rejected a task after dispose");
        }
    }

    private static void logFailure(CompletableFuture<Void> future, String what) {
        future.whenComplete((ignored, failure) -> {
            if (failure != null) {
                log.error("Router {} failed", what, failure);
            }
        });
    }

    private static RouterException disposedFailure(Throwable cause) {
        String message = "router is disposed";
        return cause == null
                ? new RouterException(RouterException.REASON_ROUTER_DISPOSED, message)
                : new RouterException(RouterException.REASON_ROUTER_DISPOSED, message, cause);
    }

    private static RouterException deferInAction() {
        return new RouterException(RouterException.REASON_DEFER_IN_ACTION, "defer() is not supported in actions");
    }

    private static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Action data to commit: the action's data, an empty map after an action error,
     * or null when no action ran.
     */
    private static Map<String, Object> actionDataOf(RouteValue pendingActionData, RouteValue pendingActionError) {
        if (pendingActionData != null) {
            return routeMap(pendingActionData);
        }
        return pendingActionError != null ? Map.of() : null;
    }

    private static Map<String, Object> routeMap(RouteValue value) {
        return Collections.singletonMap(value.routeId(), value.value());
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private static String pathnameOf(String href) {
        if (href == null) {
            return "";
        }
        int query = href.indexOf('?');
        return query >= 0 ? href.substring(0, query) : href;
    }
}
