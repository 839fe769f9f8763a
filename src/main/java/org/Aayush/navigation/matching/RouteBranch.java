package org.Aayush.navigation.matching;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;
import java.util.Objects;

/**
 * Fully joined root-to-route candidate path with its rank score.
 *
 * @param path joined path of every segment.
 * @param score rank score; higher is tried first.
 * @param routesMeta one entry per route from the root down to the branch's route.
 */
public record RouteBranch(String path, int score, List<RouteMeta> routesMeta) {
    public RouteBranch {
        Objects.requireNonNull(path, "path");
        routesMeta = List.copyOf(routesMeta);
    }

    /**
     * Positional child indexes of every segment, root first.
     */
    public IntList childrenIndexes() {
        IntArrayList indexes = new IntArrayList(routesMeta.size());
        for (RouteMeta meta : routesMeta) {
            indexes.add(meta.childrenIndex());
        }
        return indexes;
    }
}
