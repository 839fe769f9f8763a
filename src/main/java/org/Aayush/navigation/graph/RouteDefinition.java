package org.Aayush.navigation.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.navigation.data.DataFunction;
import org.Aayush.navigation.data.RevalidationPredicate;

import java.util.List;

/**
 * Declarative route node as supplied by the application.
 *
 * <p>An index route renders at its parent's URL and must not declare children.
 * A route without a path and without the index flag is a layout route: it adds its
 * children's branches but is never matched on its own.</p>
 */
@Value
@Builder(toBuilder = true)
public class RouteDefinition {

    /**
     * Explicit id, or null to derive one from the route's position in the tree.
     */
    String id;

    /**
     * Path pattern relative to the parent route, or absolute when it begins with {@code /}.
     */
    String path;

    boolean caseSensitive;

    boolean index;

    /**
     * Loader invoked to read data for this route, or null.
     */
    DataFunction loader;

    /**
     * Action invoked for mutating submissions targeting this route, or null.
     */
    DataFunction action;

    /**
     * Whether errors below this route are attributed here.
     */
    boolean hasErrorBoundary;

    /**
     * Optional override of the default revalidation decision.
     */
    RevalidationPredicate shouldRevalidate;

    /**
     * Opaque application data carried along with matches.
     */
    Object handle;

    @Singular
    List<RouteDefinition> children;
}
