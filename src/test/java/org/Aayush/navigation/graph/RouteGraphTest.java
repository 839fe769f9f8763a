package org.Aayush.navigation.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RouteGraph Tests")
class RouteGraphTest {

    private static List<RouteDefinition> sampleTree() {
        return List.of(
                RouteDefinition.builder()
                        .path("/")
                        .child(RouteDefinition.builder().index(true).build())
                        .child(RouteDefinition.builder()
                                .path("users")
                                .child(RouteDefinition.builder().id("user").path(":id").build())
                                .build())
                        .build(),
                RouteDefinition.builder().path("/about").build()
        );
    }

    @Test
    @DisplayName("Positional ids are derived depth-first")
    void testPositionalIds() {
        RouteGraph graph = RouteGraph.convertRoutesToDataRoutes(sampleTree());

        List<String> ids = new ArrayList<>();
        for (DataRoute route : graph.routes()) {
            ids.add(route.getId());
        }
        assertEquals(List.of("0", "0-0", "0-1", "user", "1"), ids);
        assertEquals(5, graph.size());
    }

    @Test
    @DisplayName("Same tree always yields the same ids")
    void testIdsAreStable() {
        List<DataRoute> first = RouteGraph.convertRoutesToDataRoutes(sampleTree()).routes();
        List<DataRoute> second = RouteGraph.convertRoutesToDataRoutes(sampleTree()).routes();

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getId(), second.get(i).getId());
        }
    }

    @Test
    @DisplayName("Parent and child links resolve through the arena")
    void testNavigation() {
        RouteGraph graph = RouteGraph.convertRoutesToDataRoutes(sampleTree());

        DataRoute user = graph.route("user");
        DataRoute users = graph.parent(user);
        assertEquals("0-1", users.getId());
        assertSame(user, graph.children(users).get(0));
        assertNull(graph.parent(graph.route("0")));
        assertEquals(2, graph.roots().size());
        assertEquals(3, user.getTreePath().size());
        assertTrue(graph.route("0-0").isIndex());
        assertFalse(graph.contains("missing"));
    }

    @Test
    @DisplayName("Duplicate explicit ids are rejected")
    void testIdCollision() {
        List<RouteDefinition> routes = List.of(
                RouteDefinition.builder().id("a").path("/").build(),
                RouteDefinition.builder().id("a").path("/x").build()
        );

        RouteConfigurationException ex = assertThrows(
                RouteConfigurationException.class,
                () -> RouteGraph.convertRoutesToDataRoutes(routes)
        );
        assertEquals(RouteConfigurationException.REASON_ROUTE_ID_COLLISION, ex.reasonCode());
    }

    @Test
    @DisplayName("Explicit id colliding with a derived id is rejected")
    void testExplicitIdCollidesWithPositional() {
        List<RouteDefinition> routes = List.of(
                RouteDefinition.builder().path("/").build(),
                RouteDefinition.builder().id("0").path("/x").build()
        );

        RouteConfigurationException ex = assertThrows(
                RouteConfigurationException.class,
                () -> RouteGraph.convertRoutesToDataRoutes(routes)
        );
        assertEquals(RouteConfigurationException.REASON_ROUTE_ID_COLLISION, ex.reasonCode());
    }

    @Test
    @DisplayName("Index routes must not declare children")
    void testIndexRouteWithChildren() {
        List<RouteDefinition> routes = List.of(RouteDefinition.builder()
                .index(true)
                .child(RouteDefinition.builder().path("x").build())
                .build());

        RouteConfigurationException ex = assertThrows(
                RouteConfigurationException.class,
                () -> RouteGraph.convertRoutesToDataRoutes(routes)
        );
        assertEquals(RouteConfigurationException.REASON_INDEX_ROUTE_WITH_CHILDREN, ex.reasonCode());
    }
}
