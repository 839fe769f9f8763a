package org.Aayush.navigation.data;

/**
 * User-supplied loader or action bound to a route.
 *
 * <p>An implementation may return:</p>
 * <ul>
 *   <li>a plain value, used as the route's data;</li>
 *   <li>a {@link DataResponse}, inspected for redirects and JSON bodies;</li>
 *   <li>a {@link java.util.concurrent.CompletionStage} producing either of the above;</li>
 *   <li>a {@link org.Aayush.navigation.deferred.DeferredData} (loaders only).</li>
 * </ul>
 *
 * <p>Throwing a {@link DataResponseException} (or completing exceptionally with one)
 * surfaces the carried response; any other throwable becomes a route error. The
 * request signal is aborted when the owning navigation or fetch is superseded.</p>
 */
@FunctionalInterface
public interface DataFunction {

    /**
     * Runs the loader or action.
     *
     * @param args request descriptor and matched params.
     * @return value, response, completion stage or deferred data.
     * @throws Exception any failure; captured into router state.
     */
    Object apply(DataFunctionArgs args) throws Exception;
}
