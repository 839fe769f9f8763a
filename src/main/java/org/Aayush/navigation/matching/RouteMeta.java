package org.Aayush.navigation.matching;

import org.Aayush.navigation.graph.DataRoute;

import java.util.Objects;

/**
 * One ancestor-to-self segment of a {@link RouteBranch}.
 *
 * @param relativePath route path relative to the parent, with absolute prefixes removed.
 * @param caseSensitive match static segments with their exact case.
 * @param childrenIndex position of the route among its siblings.
 * @param route matched route.
 */
public record RouteMeta(String relativePath, boolean caseSensitive, int childrenIndex, DataRoute route) {
    public RouteMeta {
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(route, "route");
    }
}
