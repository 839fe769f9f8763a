package org.Aayush.navigation.core.signal;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token handed to every loader, action and deferred wait.
 *
 * <p>A signal flips to aborted exactly once. Listeners registered after the abort are
 * invoked immediately on the registering thread.</p>
 */
public final class AbortSignal {
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> abortFuture = new CompletableFuture<>();

    AbortSignal() {
    }

    /**
     * Returns a signal that is never aborted.
     */
    public static AbortSignal never() {
        return new AbortSignal();
    }

    /**
     * Returns true once the owning controller aborted.
     */
    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * Registers an abort listener.
     *
     * @param listener callback invoked once on abort.
     * @return handle removing the listener.
     */
    public Runnable onAbort(Runnable listener) {
        listeners.add(listener);
        if (aborted.get() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Future completing when the signal aborts. Never completes exceptionally.
     */
    public CompletableFuture<Void> whenAborted() {
        return abortFuture;
    }

    void abort() {
        if (!aborted.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
        abortFuture.complete(null);
    }
}
