package org.Aayush.navigation.data;

import org.Aayush.navigation.deferred.DeferredData;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one loader or action call.
 *
 * <p>{@link Cancelled} only appears inside the router when a call lost the race
 * against its abort signal; it never reaches router state.</p>
 */
public sealed interface DataResult
        permits DataResult.Success, DataResult.Deferred, DataResult.Redirect, DataResult.Error, DataResult.Cancelled {

    ResultType type();

    /**
     * Plain data with an optional response status and headers.
     */
    record Success(Object data, Integer statusCode, Map<String, String> headers) implements DataResult {
        public Success {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
        }

        public static Success of(Object data) {
            return new Success(data, null, null);
        }

        @Override
        public ResultType type() {
            return ResultType.DATA;
        }
    }

    /**
     * Partially resolved loader data.
     */
    record Deferred(DeferredData deferredData) implements DataResult {
        public Deferred {
            Objects.requireNonNull(deferredData, "deferredData");
        }

        @Override
        public ResultType type() {
            return ResultType.DEFERRED;
        }
    }

    /**
     * Redirect to an already resolved, basename-prefixed location.
     *
     * @param revalidate force every loader of the follow-up navigation to run.
     */
    record Redirect(int status, String location, boolean revalidate) implements DataResult {
        public Redirect {
            Objects.requireNonNull(location, "location");
        }

        @Override
        public ResultType type() {
            return ResultType.REDIRECT;
        }
    }

    /**
     * Thrown value or error response.
     */
    record Error(Object error, Map<String, String> headers) implements DataResult {
        public Error {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
        }

        public static Error of(Object error) {
            return new Error(error, null);
        }

        @Override
        public ResultType type() {
            return ResultType.ERROR;
        }
    }

    /**
     * The call was aborted before it settled.
     */
    record Cancelled() implements DataResult {
        @Override
        public ResultType type() {
            return ResultType.CANCELLED;
        }
    }
}
