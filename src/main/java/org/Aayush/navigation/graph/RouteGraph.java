package org.Aayush.navigation.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Immutable arena of {@link DataRoute}s built once from a route tree.
 *
 * <p>Routes are stored in depth-first pre-order. Ids are either explicit or derived
 * from the positional index path joined with {@code -} (for example {@code "0-1"}),
 * so the same tree always yields the same ids.</p>
 */
public final class RouteGraph {
    private final Object2ObjectLinkedOpenHashMap<String, DataRoute> routesById;
    private final List<String> rootIds;

    private RouteGraph(Object2ObjectLinkedOpenHashMap<String, DataRoute> routesById, List<String> rootIds) {
        this.routesById = routesById;
        this.rootIds = Collections.unmodifiableList(rootIds);
    }

    /**
     * Converts a route tree into its id-addressed form.
     *
     * @param routes root route definitions.
     * @return route graph.
     * @throws RouteConfigurationException on duplicate ids or index routes with children.
     */
    public static RouteGraph convertRoutesToDataRoutes(List<RouteDefinition> routes) {
        Objects.requireNonNull(routes, "routes");
        Object2ObjectLinkedOpenHashMap<String, DataRoute> routesById = new Object2ObjectLinkedOpenHashMap<>();
        List<String> rootIds = convert(routes, null, new IntArrayList(), routesById);
        return new RouteGraph(routesById, rootIds);
    }

    private static List<String> convert(
            List<RouteDefinition> routes,
            String parentId,
            IntList parentPath,
            Object2ObjectLinkedOpenHashMap<String, DataRoute> routesById
    ) {
        List<String> ids = new ArrayList<>(routes.size());
        for (int index = 0; index < routes.size(); index++) {
            RouteDefinition route = Objects.requireNonNull(routes.get(index), "route");
            IntArrayList treePath = new IntArrayList(parentPath);
            treePath.add(index);
            String id = route.getId() != null ? route.getId() : joinTreePath(treePath);

            if (route.isIndex() && !route.getChildren().isEmpty()) {
                throw new RouteConfigurationException(
                        RouteConfigurationException.REASON_INDEX_ROUTE_WITH_CHILDREN,
                        "Cannot specify children on an index route (id " + id + ")"
                );
            }
            if (routesById.containsKey(id)) {
                throw new RouteConfigurationException(
                        RouteConfigurationException.REASON_ROUTE_ID_COLLISION,
                        "Found a route id collision on id \"" + id + "\". Route ids must be globally unique"
                );
            }

            // Reserve the id before descending so descendants cannot reuse it.
            routesById.put(id, null);
            List<String> childIds = route.isIndex()
                    ? List.of()
                    : convert(route.getChildren(), id, treePath, routesById);

            routesById.put(id, DataRoute.builder()
                    .id(id)
                    .path(route.getPath())
                    .caseSensitive(route.isCaseSensitive())
                    .index(route.isIndex())
                    .loader(route.getLoader())
                    .action(route.getAction())
                    .hasErrorBoundary(route.isHasErrorBoundary())
                    .shouldRevalidate(route.getShouldRevalidate())
                    .handle(route.getHandle())
                    .parentId(parentId)
                    .childIds(Collections.unmodifiableList(childIds))
                    .treePath(IntLists.unmodifiable(treePath))
                    .build());
            ids.add(id);
        }
        return ids;
    }

    private static String joinTreePath(IntList treePath) {
        return IntStream.range(0, treePath.size())
                .mapToObj(i -> Integer.toString(treePath.getInt(i)))
                .collect(Collectors.joining("-"));
    }

    /**
     * Root routes in declaration order.
     */
    public List<DataRoute> roots() {
        return resolve(rootIds);
    }

    /**
     * Children of {@code route} in declaration order.
     */
    public List<DataRoute> children(DataRoute route) {
        return resolve(route.getChildIds());
    }

    /**
     * Looks a route up by id.
     *
     * @return route or null when unknown.
     */
    public DataRoute route(String id) {
        return routesById.get(id);
    }

    /**
     * Parent of {@code route}, or null for a root route.
     */
    public DataRoute parent(DataRoute route) {
        return route.getParentId() == null ? null : routesById.get(route.getParentId());
    }

    public boolean contains(String id) {
        return routesById.containsKey(id);
    }

    public int size() {
        return routesById.size();
    }

    public boolean isEmpty() {
        return rootIds.isEmpty();
    }

    /**
     * Every route in depth-first pre-order.
     */
    public List<DataRoute> routes() {
        return Collections.unmodifiableList(new ArrayList<>(routesById.values()));
    }

    private List<DataRoute> resolve(List<String> ids) {
        List<DataRoute> resolved = new ArrayList<>(ids.size());
        for (String id : ids) {
            resolved.add(routesById.get(id));
        }
        return Collections.unmodifiableList(resolved);
    }
}
