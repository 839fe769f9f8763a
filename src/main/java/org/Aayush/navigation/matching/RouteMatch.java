package org.Aayush.navigation.matching;

import lombok.NonNull;
import lombok.Value;
import org.Aayush.navigation.graph.DataRoute;

import java.util.Map;

/**
 * One route of a matched chain.
 *
 * <p>Params are merged across the chain, so every match of one chain carries the
 * same complete param set.</p>
 */
@Value
public class RouteMatch {
    @NonNull
    Map<String, String> params;
    /** Portion of the URL pathname matched up to and including this route. */
    @NonNull
    String pathname;
    /** Matched pathname without any splat capture or trailing slash. */
    @NonNull
    String pathnameBase;
    @NonNull
    DataRoute route;

    public String routeId() {
        return route.getId();
    }
}
