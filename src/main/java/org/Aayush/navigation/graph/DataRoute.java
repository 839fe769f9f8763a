package org.Aayush.navigation.graph;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.Aayush.navigation.data.DataFunction;
import org.Aayush.navigation.data.RevalidationPredicate;

import java.util.List;

/**
 * Route node addressed by a stable, tree-unique id.
 *
 * <p>Parent and children are referenced by id through the owning {@link RouteGraph}.</p>
 */
@Value
@Builder
public class DataRoute {
    @NonNull
    String id;
    String path;
    boolean caseSensitive;
    boolean index;
    DataFunction loader;
    DataFunction action;
    boolean hasErrorBoundary;
    RevalidationPredicate shouldRevalidate;
    Object handle;

    /** Id of the parent route, or null for a root route. */
    String parentId;

    @NonNull
    List<String> childIds;

    /** Positional child indexes from the root down to this route. */
    @NonNull
    IntList treePath;

    public boolean hasLoader() {
        return loader != null;
    }

    public boolean hasAction() {
        return action != null;
    }

    public boolean hasChildren() {
        return !childIds.isEmpty();
    }
}
