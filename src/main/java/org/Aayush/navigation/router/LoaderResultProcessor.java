package org.Aayush.navigation.router;

import lombok.experimental.UtilityClass;
import org.Aayush.navigation.data.DataResult;
import org.Aayush.navigation.data.ErrorResponse;
import org.Aayush.navigation.deferred.DeferredData;
import org.Aayush.navigation.matching.RouteMatch;
import org.Aayush.navigation.router.RevalidationPolicy.RevalidatingFetcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds loader results into loader data, errors and fetcher states.
 */
@UtilityClass
final class LoaderResultProcessor {

    static final int OK = 200;

    /**
     * Loader data and errors keyed by route id; {@code errors} is empty when there are none.
     *
     * @param statusCode status of the first error, else the last non-200 data status, else 200.
     * @param loaderHeaders response headers of the loaders that produced any, by route id.
     */
    record ProcessedData(
            Map<String, Object> loaderData,
            Map<String, Object> errors,
            int statusCode,
            Map<String, Map<String, String>> loaderHeaders
    ) {
        static ProcessedData ofErrors(Map<String, Object> errors, int statusCode) {
            return new ProcessedData(Map.of(), errors, statusCode, Map.of());
        }
    }

    /**
     * Maps route loader results onto route ids.
     *
     * <p>Errors go to the nearest boundary of the failing route and the first error
     * recorded at a boundary stays there. The first error seen is replaced by a pending
     * action error when there is one, and it decides the status code. Deferred results
     * are registered in {@code activeDeferreds} and exposed with their tracked values.</p>
     */
    static ProcessedData processRouteLoaderData(
            List<RouteMatch> matches,
            List<RouteMatch> matchesToLoad,
            List<DataResult> results,
            RouteValue pendingError,
            Map<String, DeferredData> activeDeferreds
    ) {
        Map<String, Object> loaderData = new LinkedHashMap<>();
        Map<String, Object> errors = new LinkedHashMap<>();
        Map<String, Map<String, String>> loaderHeaders = new LinkedHashMap<>();
        RouteValue unusedPendingError = pendingError;
        int statusCode = OK;
        boolean foundError = false;

        for (int index = 0; index < results.size(); index++) {
            String id = matchesToLoad.get(index).routeId();
            DataResult result = results.get(index);
            switch (result.type()) {
                case ERROR -> {
                    DataResult.Error failed = (DataResult.Error) result;
                    RouteMatch boundaryMatch = findNearestBoundary(matches, id);
                    Object error = failed.error();
                    if (unusedPendingError != null) {
                        error = unusedPendingError.value();
                        unusedPendingError = null;
                    }
                    errors.putIfAbsent(boundaryMatch.routeId(), error);
                    if (!foundError) {
                        foundError = true;
                        statusCode = statusOf(error);
                    }
                    if (!failed.headers().isEmpty()) {
                        loaderHeaders.put(id, failed.headers());
                    }
                }
                case DEFERRED -> {
                    DeferredData deferredData = ((DataResult.Deferred) result).deferredData();
                    if (activeDeferreds != null) {
                        activeDeferreds.put(id, deferredData);
                    }
                    loaderData.put(id, deferredData.data());
                }
                case DATA -> {
                    DataResult.Success success = (DataResult.Success) result;
                    loaderData.put(id, success.data());
                    if (success.statusCode() != null && success.statusCode() != OK && !foundError) {
                        statusCode = success.statusCode();
                    }
                    if (!success.headers().isEmpty()) {
                        loaderHeaders.put(id, success.headers());
                    }
                }
                case REDIRECT, CANCELLED -> throw new IllegalStateException(
                        "Cannot handle " + result.type() + " results in processLoaderData");
            }
        }

        if (unusedPendingError != null) {
            errors = new LinkedHashMap<>();
            errors.put(unusedPendingError.routeId(), unusedPendingError.value());
            statusCode = statusOf(unusedPendingError.value());
        }
        return new ProcessedData(loaderData, errors, statusCode, loaderHeaders);
    }

    /**
     * HTTP status an error stands for: its own for error responses, 500 otherwise.
     */
    static int statusOf(Object error) {
        return error instanceof ErrorResponse response ? response.getStatus() : 500;
    }

    /**
     * Processes route results, then settles every revalidated fetcher in {@code fetchers}.
     *
     * <p>A failing fetcher is removed and its error recorded at the nearest boundary of
     * its route in {@code currentMatches}, unless that boundary already has an error.</p>
     */
    static ProcessedData processLoaderData(
            List<RouteMatch> currentMatches,
            List<RouteMatch> matches,
            List<RouteMatch> matchesToLoad,
            List<DataResult> results,
            RouteValue pendingError,
            List<RevalidatingFetcher> revalidatingFetchers,
            List<DataResult> fetcherResults,
            Map<String, DeferredData> activeDeferreds,
            Map<String, Fetcher> fetchers
    ) {
        ProcessedData processed = processRouteLoaderData(matches, matchesToLoad, results, pendingError, activeDeferreds);
        Map<String, Object> errors = new LinkedHashMap<>(processed.errors());

        for (int index = 0; index < revalidatingFetchers.size(); index++) {
            RevalidatingFetcher fetcher = revalidatingFetchers.get(index);
            DataResult result = fetcherResults.get(index);
            switch (result.type()) {
                case ERROR -> {
                    RouteMatch boundaryMatch = findNearestBoundary(currentMatches, fetcher.match().routeId());
                    errors.putIfAbsent(boundaryMatch.routeId(), ((DataResult.Error) result).error());
                    fetchers.remove(fetcher.key());
                }
                case DATA -> fetchers.put(fetcher.key(), Fetcher.idle(((DataResult.Success) result).data()));
                case REDIRECT -> throw new IllegalStateException("Unhandled fetcher revalidation redirect");
                case DEFERRED -> throw new IllegalStateException("Unhandled fetcher deferred data");
                case CANCELLED -> throw new IllegalStateException("Unhandled cancelled fetcher revalidation");
            }
        }
        return new ProcessedData(processed.loaderData(), errors, processed.statusCode(), processed.loaderHeaders());
    }

    /**
     * Keeps data of matched routes that were not reloaded.
     */
    static Map<String, Object> mergeLoaderData(
            Map<String, Object> loaderData,
            Map<String, Object> newLoaderData,
            List<RouteMatch> matches
    ) {
        Map<String, Object> merged = new LinkedHashMap<>(newLoaderData);
        for (RouteMatch match : matches) {
            String id = match.routeId();
            if (!newLoaderData.containsKey(id) && loaderData.containsKey(id)) {
                merged.put(id, loaderData.get(id));
            }
        }
        return Collections.unmodifiableMap(merged);
    }

    /**
     * Nearest match at or above {@code routeId} whose route owns an error boundary,
     * or the root match.
     *
     * @param routeId failing route, or null to search the whole chain.
     */
    static RouteMatch findNearestBoundary(List<RouteMatch> matches, String routeId) {
        int last = matches.size() - 1;
        if (routeId != null) {
            last = RevalidationPolicy.indexOfRoute(matches, routeId);
        }
        for (int i = last; i >= 0; i--) {
            if (matches.get(i).getRoute().isHasErrorBoundary()) {
                return matches.get(i);
            }
        }
        return matches.get(0);
    }

    /**
     * Deepest redirect among {@code results}, or null.
     */
    static DataResult.Redirect findRedirect(List<DataResult> results) {
        for (int i = results.size() - 1; i >= 0; i--) {
            if (results.get(i) instanceof DataResult.Redirect redirect) {
                return redirect;
            }
        }
        return null;
    }
}
