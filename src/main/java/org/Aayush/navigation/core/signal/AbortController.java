package org.Aayush.navigation.core.signal;

/**
 * Owner side of an {@link AbortSignal}.
 */
public final class AbortController {
    private final AbortSignal signal = new AbortSignal();

    /**
     * Signal observed by cancellable work.
     */
    public AbortSignal signal() {
        return signal;
    }

    /**
     * Aborts the signal. Repeated calls are no-ops.
     */
    public void abort() {
        signal.abort();
    }
}
