package org.Aayush.navigation.deferred;

/**
 * Settles tracked values of a cancelled {@link DeferredData}.
 *
 * <p>The router treats this as a cancellation marker and never records it as a
 * route error.</p>
 */
public final class AbortedDeferredException extends RuntimeException {

    public AbortedDeferredException(String message) {
        super(message, null, false, false);
    }
}
