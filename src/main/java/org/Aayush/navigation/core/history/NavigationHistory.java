package org.Aayush.navigation.core.history;

import java.util.function.Consumer;

/**
 * History collaborator contract used by the router.
 *
 * <p>The router only calls the mutators ({@link #push}, {@link #replace}) after a
 * navigation has fully settled, including every redirect hop. Storage of the stack
 * itself is up to the implementation.</p>
 */
public interface NavigationHistory {

    /**
     * Last action that modified the current location.
     */
    HistoryAction action();

    /**
     * Current location.
     */
    Location location();

    /**
     * Returns an href usable by a link for the given path.
     */
    String createHref(Path to);

    /**
     * Encodes a location the same way the underlying platform would on a read.
     */
    Location encodeLocation(Location location);

    /**
     * Pushes a new entry, dropping any forward entries.
     */
    void push(Path to, Object state);

    /**
     * Replaces the current entry.
     */
    void replace(Path to, Object state);

    /**
     * Moves {@code delta} entries through the stack and notifies the listener with a POP.
     */
    void go(int delta);

    /**
     * Registers the single POP listener.
     *
     * @return handle that removes the listener.
     */
    Runnable listen(Consumer<HistoryUpdate> listener);
}
