package org.Aayush.navigation.router;

import org.Aayush.navigation.core.history.Path;
import org.Aayush.navigation.core.path.PathUtils;
import org.Aayush.navigation.core.signal.AbortSignal;
import org.Aayush.navigation.data.DataFunction;
import org.Aayush.navigation.data.DataFunctionArgs;
import org.Aayush.navigation.data.DataRequest;
import org.Aayush.navigation.data.DataResponse;
import org.Aayush.navigation.data.DataResponseException;
import org.Aayush.navigation.data.DataResult;
import org.Aayush.navigation.data.ErrorResponse;
import org.Aayush.navigation.data.FormMethod;
import org.Aayush.navigation.data.JsonBodyCodec;
import org.Aayush.navigation.data.Submission;
import org.Aayush.navigation.deferred.DeferredData;
import org.Aayush.navigation.matching.RouteMatch;
import org.Aayush.navigation.matching.RouteMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Calls loaders and actions and turns whatever they produce into a {@link DataResult}.
 *
 * <p>Each call is raced against the request's abort signal. Results are delivered on
 * the router loop.</p>
 */
final class DataFunctionInvoker {
    private static final Logger log = LoggerFactory.getLogger(DataFunctionInvoker.class);

    enum Kind {
        LOADER,
        ACTION
    }

    private record Settled(Object value, Throwable failure, boolean aborted) {
        static final Settled ABORTED = new Settled(null, null, true);
    }

    /**
     * Outcome of a call made for a server-side query.
     *
     * <p>Either {@code result} is set, or {@code response} is a response to hand back
     * unprocessed, with {@code thrown} telling whether route code threw it.</p>
     */
    record StaticOutcome(DataResult result, DataResponse response, boolean thrown) {
        boolean isResponse() {
            return response != null;
        }
    }

    private final Executor loop;
    private final String basename;
    private final String origin;
    private final JsonBodyCodec jsonCodec;

    DataFunctionInvoker(Executor loop, String basename, String origin, JsonBodyCodec jsonCodec) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.basename = basename;
        this.origin = Objects.requireNonNull(origin, "origin");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    /**
     * Builds the request for {@code location} without its fragment identifier.
     */
    DataRequest createRequest(Path location, AbortSignal signal, Submission submission) {
        DataRequest.DataRequestBuilder request = DataRequest.builder()
                .origin(origin)
                .path(location.withoutHash())
                .signal(signal);
        if (submission != null) {
            request.method(submission.getFormMethod())
                    .encType(submission.getFormEncType())
                    .formData(submission.getFormData());
        } else {
            request.method(FormMethod.GET);
        }
        return request.build();
    }

    /**
     * Runs the loader or action of {@code match}.
     *
     * @param matches full match chain; relative redirects resolve against it.
     * @return result completed on the router loop.
     */
    CompletableFuture<DataResult> call(Kind kind, DataRequest request, RouteMatch match, List<RouteMatch> matches) {
        return race(kind, request, match)
                .thenApplyAsync(settled -> toResult(settled, request, match, matches), loop);
    }

    /**
     * Runs the loader or action of {@code match} for a server-side query.
     *
     * <p>Redirects are not followed: their resolved location is written back into the
     * response, which is handed back as is. For single-route requests every other
     * response is handed back as well.</p>
     */
    CompletableFuture<StaticOutcome> callStatic(
            Kind kind,
            DataRequest request,
            RouteMatch match,
            List<RouteMatch> matches,
            boolean isRouteRequest
    ) {
        return race(kind, request, match).thenApplyAsync(settled -> {
            if (!settled.aborted()) {
                boolean isError = settled.failure() != null;
                Object raw = isError ? settled.failure() : settled.value();
                if (raw instanceof DataResponseException thrown) {
                    raw = thrown.getResponse();
                }
                if (raw instanceof DataResponse response) {
                    String location = response.header(DataResponse.LOCATION);
                    if (response.isRedirect() && location != null) {
                        DataResponse resolved = response.toBuilder()
                                .clearHeaders()
                                .headers(withoutHeader(response.getHeaders(), DataResponse.LOCATION))
                                .header(DataResponse.LOCATION, resolveRedirectLocation(location, request, match, matches))
                                .build();
                        return new StaticOutcome(null, resolved, isError);
                    }
                    if (isRouteRequest && !response.isRedirect()) {
                        return new StaticOutcome(null, response, isError);
                    }
                }
            }
            return new StaticOutcome(toResult(settled, request, match, matches), null, false);
        }, loop);
    }

    /**
     * Calls the handler and races its outcome against the request's abort signal.
     */
    private CompletableFuture<Settled> race(Kind kind, DataRequest request, RouteMatch match) {
        DataFunction handler = kind == Kind.LOADER ? match.getRoute().getLoader() : match.getRoute().getAction();
        CompletableFuture<Object> outcome;
        if (handler == null) {
            outcome = CompletableFuture.failedFuture(new IllegalStateException(
                    "Could not find the " + kind.name().toLowerCase() + " to run on the \"" + match.routeId() + "\" route"
            ));
        } else {
            outcome = invoke(handler, request, match);
        }

        CompletableFuture<Settled> raced = new CompletableFuture<>();
        Runnable removeAbortListener = request.getSignal().onAbort(() -> raced.complete(Settled.ABORTED));
        outcome.whenComplete((value, failure) -> raced.complete(failure == null
                ? new Settled(value, null, false)
                : new Settled(null, unwrap(failure), false)));
        raced.whenComplete((settled, failure) -> removeAbortListener.run());
        return raced;
    }

    private static CompletableFuture<Object> invoke(DataFunction handler, DataRequest request, RouteMatch match) {
        try {
            Object returned = handler.apply(DataFunctionArgs.builder()
                    .request(request)
                    .params(match.getParams())
                    .build());
            if (returned instanceof CompletionStage<?> stage) {
                return stage.<Object>thenApply(value -> value).toCompletableFuture();
            }
            return CompletableFuture.completedFuture(returned);
        } catch (Throwable t) {
            // Errors thrown by route code are captured like any other failure.
            return CompletableFuture.failedFuture(t);
        }
    }

    private DataResult toResult(Settled settled, DataRequest request, RouteMatch match, List<RouteMatch> matches) {
        if (settled.aborted()) {
            return new DataResult.Cancelled();
        }
        boolean isError = settled.failure() != null;
        Object result = isError ? settled.failure() : settled.value();
        if (result instanceof DataResponseException thrown) {
            result = thrown.getResponse();
        }
        if (result instanceof DataResponse response) {
            return fromResponse(response, isError, request, match, matches);
        }
        if (isError) {
            return DataResult.Error.of(result);
        }
        if (result instanceof DeferredData deferredData) {
            return new DataResult.Deferred(deferredData);
        }
        return DataResult.Success.of(result);
    }

    private DataResult fromResponse(
            DataResponse response,
            boolean isError,
            DataRequest request,
            RouteMatch match,
            List<RouteMatch> matches
    ) {
        int status = response.getStatus();
        if (response.isRedirect()) {
            String location = response.header(DataResponse.LOCATION);
            if (location == null) {
                log.warn("Route {} returned a {} response without a Location header", match.routeId(), status);
                return DataResult.Error.of(new RouterException(
                        RouterException.REASON_MISSING_REDIRECT_LOCATION,
                        "Redirects returned/thrown from loaders/actions must have a Location header"
                ));
            }
            return new DataResult.Redirect(
                    status,
                    resolveRedirectLocation(location, request, match, matches),
                    response.header(DataResponse.REVALIDATE) != null
            );
        }

        Object data;
        try {
            data = response.isJson() ? jsonCodec.readBody(response.getBody()) : response.getBody();
        } catch (IllegalArgumentException e) {
            return DataResult.Error.of(e);
        }
        if (isError) {
            return new DataResult.Error(new ErrorResponse(status, response.getStatusText(), data), response.getHeaders());
        }
        return new DataResult.Success(data, status, response.getHeaders());
    }

    /**
     * Resolves a possibly relative redirect against the path-contributing matches up to
     * {@code match}, then prefixes the basename.
     */
    private String resolveRedirectLocation(String location, DataRequest request, RouteMatch match, List<RouteMatch> matches) {
        List<RouteMatch> activeMatches = matches.subList(0, matches.indexOf(match) + 1);
        List<String> routePathnames = new ArrayList<>();
        for (RouteMatch contributing : RouteMatcher.getPathContributingMatches(activeMatches)) {
            routePathnames.add(contributing.getPathnameBase());
        }
        Path resolved = PathUtils.resolveTo(Path.parse(location), routePathnames, request.getPath().pathname());
        if (basename != null && !basename.isEmpty()) {
            String pathname = resolved.pathname();
            resolved = resolved.withPathname("/".equals(pathname) ? basename : PathUtils.joinPaths(basename, pathname));
        }
        return resolved.toHref();
    }

    private static Map<String, String> withoutHeader(Map<String, String> headers, String name) {
        Map<String, String> kept = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (!entry.getKey().equalsIgnoreCase(name)) {
                kept.put(entry.getKey(), entry.getValue());
            }
        }
        return kept;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
