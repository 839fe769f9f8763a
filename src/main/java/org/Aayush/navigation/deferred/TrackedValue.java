package org.Aayush.navigation.deferred;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous value tracked by a {@link DeferredData}.
 *
 * <p>{@link #future()} completes with the value, or exceptionally with the loader's
 * error or an {@link AbortedDeferredException} once cancelled.</p>
 */
@Accessors(fluent = true)
public final class TrackedValue {

    /**
     * Settlement state of one tracked key.
     */
    public enum State {
        PENDING,
        RESOLVED,
        REJECTED,
        CANCELLED
    }

    @Getter
    private final String key;
    private final CompletableFuture<Object> future = new CompletableFuture<>();
    private volatile State state = State.PENDING;
    private volatile Object data;
    private volatile Throwable error;

    TrackedValue(String key) {
        this.key = key;
    }

    public State state() {
        return state;
    }

    public boolean isSettled() {
        return state != State.PENDING;
    }

    /**
     * Resolved value, or null while pending or when the value failed.
     */
    public Object data() {
        return data;
    }

    /**
     * Failure of a rejected or cancelled value, or null.
     */
    public Throwable error() {
        return error;
    }

    /**
     * Read-only view of the settlement.
     */
    public CompletableFuture<Object> future() {
        return future.copy();
    }

    /**
     * Settlement transitions only leave {@link State#PENDING}; later calls are ignored.
     */
    synchronized boolean resolve(Object value) {
        if (state != State.PENDING) {
            return false;
        }
        this.data = value;
        this.state = State.RESOLVED;
        future.complete(value);
        return true;
    }

    synchronized boolean reject(Throwable cause) {
        if (state != State.PENDING) {
            return false;
        }
        this.error = cause;
        this.state = State.REJECTED;
        future.completeExceptionally(cause);
        return true;
    }

    synchronized boolean cancel(AbortedDeferredException cause) {
        if (state != State.PENDING) {
            return false;
        }
        this.error = cause;
        this.state = State.CANCELLED;
        future.completeExceptionally(cause);
        return true;
    }

    @Override
    public String toString() {
        return "TrackedValue[" + key + "=" + state + "]";
    }
}
