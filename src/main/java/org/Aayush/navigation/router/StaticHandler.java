package org.Aayush.navigation.router;

import org.Aayush.navigation.core.history.Location;
import org.Aayush.navigation.data.DataRequest;
import org.Aayush.navigation.data.DataResponse;
import org.Aayush.navigation.data.DataResponseException;
import org.Aayush.navigation.data.DataResult;
import org.Aayush.navigation.data.ErrorResponse;
import org.Aayush.navigation.data.FormMethod;
import org.Aayush.navigation.data.JsonBodyCodec;
import org.Aayush.navigation.graph.RouteConfigurationException;
import org.Aayush.navigation.graph.RouteDefinition;
import org.Aayush.navigation.graph.RouteGraph;
import org.Aayush.navigation.matching.RouteMatch;
import org.Aayush.navigation.matching.RouteMatcher;
import org.Aayush.navigation.router.DataFunctionInvoker.Kind;
import org.Aayush.navigation.router.DataFunctionInvoker.StaticOutcome;
import org.Aayush.navigation.router.LoaderResultProcessor.ProcessedData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the loaders and actions of a route tree for one request at a time, without a
 * history or any state between requests.
 *
 * <p>{@link #query} gathers everything needed to render a document request.
 * {@link #queryRoute} answers a data request for a single route.</p>
 */
public final class StaticHandler {
    private static final Logger log = LoggerFactory.getLogger(StaticHandler.class);

    static final String ROUTER_ERROR_HEADER = "X-Remix-Router-Error";

    private record Outcome(StaticHandlerContext context, DataResponse response, boolean thrown) {
        static Outcome of(StaticHandlerContext context) {
            return new Outcome(context, null, false);
        }

        static Outcome of(StaticOutcome outcome) {
            return new Outcome(null, outcome.response(), outcome.thrown());
        }
    }

    private final RouteGraph graph;
    private final RouteMatcher matcher;
    private final DataFunctionInvoker invoker;

    /**
     * @throws RouteConfigurationException when the route tree is empty or invalid.
     */
    public StaticHandler(List<RouteDefinition> routes) {
        Objects.requireNonNull(routes, "routes");
        if (routes.isEmpty()) {
            throw new RouteConfigurationException(
                    RouteConfigurationException.REASON_EMPTY_ROUTES,
                    "a static handler needs at least one route"
            );
        }
        this.graph = RouteGraph.convertRoutesToDataRoutes(routes);
        this.matcher = new RouteMatcher(graph);
        this.invoker = new DataFunctionInvoker(Runnable::run, null, RouterInit.defaultOrigin(), JsonBodyCodec.defaults());
    }

    public RouteGraph routes() {
        return graph;
    }

    /**
     * Runs the action (for a mutation) and the loaders matched by {@code request}.
     *
     * <p>An unmatched path yields a 404 context. Redirects, and responses without a
     * render context, come back as {@link QueryResult.RawResponse}.</p>
     *
     * @return the result; fails with {@link IllegalStateException} when the request
     * is aborted while route code runs.
     */
    public CompletableFuture<QueryResult> query(DataRequest request) {
        Objects.requireNonNull(request, "request");
        Location location = Location.create("", request.getPath(), null, Location.DEFAULT_KEY);
        List<RouteMatch> matches = matcher.matchRoutes(location.toPath(), "/");
        if (matches == null) {
            NavigationRequests.ShortCircuit notFound = NavigationRequests.getNotFoundMatches(graph);
            return CompletableFuture.completedFuture(StaticHandlerContext.builder()
                    .location(location)
                    .matches(notFound.matches())
                    .errors(Map.of(notFound.route().getId(), notFound.error()))
                    .statusCode(notFound.error().getStatus())
                    .build());
        }
        return queryImpl(request, location, matches, null).<QueryResult>thenApply(outcome -> outcome.response() != null
                ? new QueryResult.RawResponse(outcome.response())
                : outcome.context());
    }

    /**
     * Runs the action (for a mutation) or the loader of one route and returns its data.
     *
     * @param routeId route to run; null targets the deepest path-owning match.
     * @return the route's data, or a redirect response; fails with the route's error,
     * or with a {@link DataResponseException} for a response route code threw or for a
     * 404 or 405 raised here.
     */
    public CompletableFuture<Object> queryRoute(DataRequest request, String routeId) {
        Objects.requireNonNull(request, "request");
        Location location = Location.create("", request.getPath(), null, Location.DEFAULT_KEY);
        List<RouteMatch> matches = matcher.matchRoutes(location.toPath(), "/");
        if (matches == null) {
            return CompletableFuture.failedFuture(routerError(404, "Not Found"));
        }
        RouteMatch routeMatch = null;
        if (routeId == null) {
            routeMatch = NavigationRequests.getTargetMatch(matches, location.getSearch());
        } else {
            for (RouteMatch match : matches) {
                if (match.routeId().equals(routeId)) {
                    routeMatch = match;
                    break;
                }
            }
        }
        if (routeMatch == null) {
            return CompletableFuture.failedFuture(routerError(404, "Not Found"));
        }

        RouteMatch target = routeMatch;
        return queryImpl(request, location, matches, target).<Object>thenCompose(outcome -> {
            if (outcome.response() != null) {
                if (outcome.thrown() && !outcome.response().isRedirect()) {
                    return CompletableFuture.failedFuture(new DataResponseException(outcome.response()));
                }
                return CompletableFuture.completedFuture(outcome.response());
            }
            StaticHandlerContext context = outcome.context();
            if (!context.getErrors().isEmpty()) {
                return CompletableFuture.failedFuture(asThrowable(context.getErrors().values().iterator().next()));
            }
            Map<String, Object> routeData = context.getActionData() != null
                    ? context.getActionData()
                    : context.getLoaderData();
            return CompletableFuture.completedFuture(routeData.get(target.routeId()));
        });
    }

    private CompletableFuture<Outcome> queryImpl(
            DataRequest request,
            Location location,
            List<RouteMatch> matches,
            RouteMatch routeMatch
    ) {
        if (request.getMethod().isMutation()) {
            RouteMatch actionMatch = routeMatch != null
                    ? routeMatch
                    : NavigationRequests.getTargetMatch(matches, location.getSearch());
            return submit(request, location, matches, actionMatch, routeMatch != null);
        }
        return loadRouteData(request, location, matches, routeMatch, null);
    }

    private CompletableFuture<Outcome> submit(
            DataRequest request,
            Location location,
            List<RouteMatch> matches,
            RouteMatch actionMatch,
            boolean isRouteRequest
    ) {
        CompletableFuture<StaticOutcome> action;
        if (!actionMatch.getRoute().hasAction()) {
            if (isRouteRequest) {
                return CompletableFuture.failedFuture(routerError(405, "Method Not Allowed"));
            }
            ErrorResponse error = NavigationRequests.methodNotAllowed(location.toHref());
            action = CompletableFuture.completedFuture(new StaticOutcome(DataResult.Error.of(error), null, false));
        } else {
            action = invoker.callStatic(Kind.ACTION, request, actionMatch, matches, isRouteRequest)
                    .thenApply(outcome -> checkAborted(request, outcome));
        }

        return action.thenCompose(outcome -> {
            if (outcome.isResponse()) {
                return CompletableFuture.completedFuture(Outcome.of(outcome));
            }
            DataResult result = outcome.result();
            if (result instanceof DataResult.Deferred) {
                throw new RouterException(RouterException.REASON_DEFER_IN_ACTION, "defer() is not supported in actions");
            }

            String actionId = actionMatch.routeId();
            if (isRouteRequest) {
                StaticHandlerContext.StaticHandlerContextBuilder context = StaticHandlerContext.builder()
                        .location(location)
                        .matches(matches);
                if (result instanceof DataResult.Error failed) {
                    context.errors(Map.of(actionId, failed.error()))
                            .statusCode(LoaderResultProcessor.statusOf(failed.error()));
                } else {
                    context.actionData(singleton(actionId, ((DataResult.Success) result).data()));
                }
                return CompletableFuture.completedFuture(Outcome.of(context.build()));
            }

            DataRequest loaderRequest = DataRequest.builder()
                    .origin(request.getOrigin())
                    .path(request.getPath())
                    .method(FormMethod.GET)
                    .signal(request.getSignal())
                    .build();
            if (result instanceof DataResult.Error failed) {
                RouteMatch boundaryMatch = LoaderResultProcessor.findNearestBoundary(matches, actionId);
                RouteValue pendingError = new RouteValue(boundaryMatch.routeId(), failed.error());
                return loadRouteData(loaderRequest, location, matches, null, pendingError)
                        .thenApply(loaded -> loaded.context() == null ? loaded : Outcome.of(loaded.context().toBuilder()
                                .statusCode(LoaderResultProcessor.statusOf(failed.error()))
                                .actionHeaders(headersOf(actionId, failed.headers()))
                                .build()));
            }

            DataResult.Success success = (DataResult.Success) result;
            return loadRouteData(loaderRequest, location, matches, null, null)
                    .thenApply(loaded -> {
                        if (loaded.context() == null) {
                            return loaded;
                        }
                        StaticHandlerContext.StaticHandlerContextBuilder context = loaded.context().toBuilder()
                                .actionData(singleton(actionId, success.data()))
                                .actionHeaders(headersOf(actionId, success.headers()));
                        if (success.statusCode() != null) {
                            context.statusCode(success.statusCode());
                        }
                        return Outcome.of(context.build());
                    });
        });
    }

    private CompletableFuture<Outcome> loadRouteData(
            DataRequest request,
            Location location,
            List<RouteMatch> matches,
            RouteMatch routeMatch,
            RouteValue pendingActionError
    ) {
        boolean isRouteRequest = routeMatch != null;
        if (isRouteRequest && !routeMatch.getRoute().hasLoader()) {
            return CompletableFuture.failedFuture(routerError(400, "Bad Request"));
        }
        List<RouteMatch> requestMatches = isRouteRequest
                ? List.of(routeMatch)
                : RevalidationPolicy.getLoaderMatchesUntilBoundary(
                        matches, pendingActionError != null ? pendingActionError.routeId() : null);
        List<RouteMatch> matchesToLoad = new ArrayList<>();
        for (RouteMatch match : requestMatches) {
            if (match.getRoute().hasLoader()) {
                matchesToLoad.add(match);
            }
        }

        StaticHandlerContext.StaticHandlerContextBuilder context = StaticHandlerContext.builder()
                .location(location)
                .matches(matches);
        if (matchesToLoad.isEmpty()) {
            if (pendingActionError != null) {
                context.errors(Map.of(pendingActionError.routeId(), pendingActionError.value()))
                        .statusCode(LoaderResultProcessor.statusOf(pendingActionError.value()));
            }
            return CompletableFuture.completedFuture(Outcome.of(context.build()));
        }

        List<CompletableFuture<StaticOutcome>> calls = new ArrayList<>();
        for (RouteMatch match : matchesToLoad) {
            calls.add(invoker.callStatic(Kind.LOADER, request, match, matches, isRouteRequest));
        }
        return CompletableFuture.allOf(calls.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
            List<DataResult> results = new ArrayList<>();
            for (CompletableFuture<StaticOutcome> call : calls) {
                StaticOutcome outcome = checkAborted(request, call.join());
                if (outcome.isResponse()) {
                    return Outcome.of(outcome);
                }
                results.add(outcome.result());
            }
            for (DataResult result : results) {
                if (result instanceof DataResult.Deferred deferred) {
                    // Nothing streams the rest of a deferred record to the client.
                    deferred.deferredData().cancel();
                }
            }
            ProcessedData processed = LoaderResultProcessor.processRouteLoaderData(
                    matches, matchesToLoad, results, pendingActionError, null);
            return Outcome.of(context
                    .loaderData(processed.loaderData())
                    .errors(processed.errors())
                    .statusCode(processed.statusCode())
                    .loaderHeaders(processed.loaderHeaders())
                    .build());
        });
    }

    private static StaticOutcome checkAborted(DataRequest request, StaticOutcome outcome) {
        if (request.getSignal().isAborted()) {
            log.debug("Static query for {} aborted", request.getUrl());
            throw new IllegalStateException("query() call aborted");
        }
        return outcome;
    }

    private static DataResponseException routerError(int status, String statusText) {
        return new DataResponseException(DataResponse.builder()
                .status(status)
                .statusText(statusText)
                .header(ROUTER_ERROR_HEADER, "yes")
                .build());
    }

    private static Throwable asThrowable(Object error) {
        if (error instanceof Throwable throwable) {
            return throwable;
        }
        if (error instanceof ErrorResponse response) {
            return new DataResponseException(DataResponse.builder()
                    .status(response.getStatus())
                    .statusText(response.getStatusText())
                    .body(response.getData())
                    .build());
        }
        return new IllegalStateException(String.valueOf(error));
    }

    private static Map<String, Object> singleton(String routeId, Object data) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(routeId, data);
        return values;
    }

    private static Map<String, Map<String, String>> headersOf(String routeId, Map<String, String> headers) {
        return headers.isEmpty() ? Map.of() : Map.of(routeId, headers);
    }
}
