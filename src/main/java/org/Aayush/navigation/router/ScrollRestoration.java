package org.Aayush.navigation.router;

import org.Aayush.navigation.core.history.Location;
import org.Aayush.navigation.matching.RouteMatch;

import java.util.List;

/**
 * Scroll bookkeeping supplied by the rendering layer.
 */
public interface ScrollRestoration {

    /**
     * Current vertical scroll offset.
     */
    int currentScrollPosition();

    /**
     * Key under which the position for {@code location} is saved.
     * Defaults to the location key.
     */
    default String restorationKey(Location location, List<RouteMatch> matches) {
        return location.getKey();
    }
}
