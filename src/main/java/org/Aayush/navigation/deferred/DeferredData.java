package org.Aayush.navigation.deferred;

import it.unimi.dsi.fastutil.booleans.BooleanConsumer;
import org.Aayush.navigation.core.signal.AbortController;
import org.Aayush.navigation.core.signal.AbortSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Cancellable record of partly resolved loader values.
 *
 * <p>Every {@link CompletionStage} value is tracked under its key and raced against an
 * internal abort signal; plain values are kept as they are. The record is
 * {@linkplain #isDone() done} once no key is pending, either because every value
 * settled or because the record was {@linkplain #cancel() cancelled}. After
 * cancellation no further settlement is observed.</p>
 *
 * <p>A single subscriber is notified with {@code false} on each settlement and with
 * {@code true} on cancellation. Notifications may arrive on any thread.</p>
 */
public final class DeferredData {
    private static final Logger log = LoggerFactory.getLogger(DeferredData.class);

    private final Object lock = new Object();
    private final AbortController controller = new AbortController();
    private final Map<String, Object> data;
    private final Set<String> pendingKeys = new LinkedHashSet<>();
    private volatile BooleanConsumer subscriber;

    /**
     * Wraps {@code values}; completion stages among them are tracked.
     */
    public DeferredData(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Map<String, Object> tracked = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            tracked.put(entry.getKey(), track(entry.getKey(), entry.getValue()));
        }
        this.data = Collections.unmodifiableMap(tracked);
    }

    /**
     * Creates deferred data from {@code values}.
     */
    public static DeferredData defer(Map<String, ?> values) {
        return new DeferredData(values);
    }

    private Object track(String key, Object value) {
        if (!(value instanceof CompletionStage<?> stage)) {
            return value;
        }
        TrackedValue trackedValue = new TrackedValue(key);
        synchronized (lock) {
            pendingKeys.add(key);
        }
        Runnable removeAbortListener = controller.signal()
                .onAbort(() -> trackedValue.cancel(new AbortedDeferredException("Deferred data aborted")));
        stage.whenComplete((result, failure) -> {
            removeAbortListener.run();
            onSettle(trackedValue, result, failure);
        });
        return trackedValue;
    }

    private void onSettle(TrackedValue trackedValue, Object result, Throwable failure) {
        synchronized (lock) {
            if (controller.signal().isAborted()) {
                return;
            }
            pendingKeys.remove(trackedValue.key());
            if (failure != null) {
                trackedValue.reject(unwrap(failure));
            } else {
                trackedValue.resolve(result);
            }
        }
        notifySubscriber(false);
    }

    /**
     * Registers the single subscriber, replacing any previous one.
     */
    public void subscribe(BooleanConsumer fn) {
        this.subscriber = fn;
    }

    /**
     * Aborts every pending value and notifies the subscriber with {@code true}.
     */
    public void cancel() {
        synchronized (lock) {
            controller.abort();
            pendingKeys.clear();
        }
        log.debug("Deferred data cancelled");
        notifySubscriber(true);
    }

    /**
     * Waits until every value settles or {@code signal} aborts.
     *
     * <p>An abort of {@code signal} cancels this record.</p>
     *
     * @return future of the aborted flag.
     */
    public CompletableFuture<Boolean> resolveData(AbortSignal signal) {
        Objects.requireNonNull(signal, "signal");
        if (isDone()) {
            return CompletableFuture.completedFuture(controller.signal().isAborted());
        }
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        Runnable removeAbortListener = signal.onAbort(this::cancel);
        subscribe(aborted -> {
            if (aborted || isDone()) {
                removeAbortListener.run();
                result.complete(aborted);
            }
        });
        // A value may have settled between the done check and subscribing.
        if (isDone()) {
            removeAbortListener.run();
            result.complete(controller.signal().isAborted());
        }
        return result;
    }

    /**
     * True once no tracked value is pending.
     */
    public boolean isDone() {
        synchronized (lock) {
            return pendingKeys.isEmpty();
        }
    }

    public boolean isAborted() {
        return controller.signal().isAborted();
    }

    public Set<String> pendingKeys() {
        synchronized (lock) {
            return Set.copyOf(pendingKeys);
        }
    }

    /**
     * Raw record: plain values plus {@link TrackedValue}s for asynchronous ones.
     */
    public Map<String, Object> data() {
        return data;
    }

    /**
     * Materializes the settled record.
     *
     * @return plain key/value record.
     * @throws IllegalStateException when values are still pending.
     * @throws Exception the first failure of a rejected or cancelled value.
     */
    public Map<String, Object> unwrappedData() throws Exception {
        if (!isDone()) {
            throw new IllegalStateException("Can only unwrap data on initialized and settled deferreds");
        }
        Map<String, Object> unwrapped = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof TrackedValue trackedValue) {
                Throwable error = trackedValue.error();
                if (error instanceof Exception exception) {
                    throw exception;
                }
                if (error instanceof Error fatal) {
                    throw fatal;
                }
                if (error != null) {
                    throw new ExecutionException(error);
                }
                unwrapped.put(entry.getKey(), trackedValue.data());
            } else {
                unwrapped.put(entry.getKey(), value);
            }
        }
        return Collections.unmodifiableMap(unwrapped);
    }

    private void notifySubscriber(boolean aborted) {
        BooleanConsumer current = subscriber;
        if (current != null) {
            current.accept(aborted);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public String toString() {
        return "DeferredData" + data.keySet() + " pending=" + pendingKeys();
    }
}
