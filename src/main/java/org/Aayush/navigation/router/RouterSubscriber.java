package org.Aayush.navigation.router;

/**
 * Receives every committed router state.
 */
@FunctionalInterface
public interface RouterSubscriber {

    void onStateChange(RouterState state);
}
