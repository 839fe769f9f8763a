package org.Aayush.navigation.router;

import java.util.Objects;

/**
 * Single route-keyed value: the pending action data or error of a navigation.
 */
record RouteValue(String routeId, Object value) {
    RouteValue {
        Objects.requireNonNull(routeId, "routeId");
    }
}
