package org.Aayush.navigation.router;

import org.Aayush.navigation.core.history.Path;
import org.Aayush.navigation.core.signal.AbortController;
import org.Aayush.navigation.core.signal.AbortSignal;
import org.Aayush.navigation.data.DataRequest;
import org.Aayush.navigation.data.DataResponse;
import org.Aayush.navigation.data.DataResponseException;
import org.Aayush.navigation.data.ErrorResponse;
import org.Aayush.navigation.data.FormData;
import org.Aayush.navigation.data.FormEncType;
import org.Aayush.navigation.data.FormMethod;
import org.Aayush.navigation.graph.RouteConfigurationException;
import org.Aayush.navigation.graph.RouteDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.Aayush.navigation.testutil.RouterTestSupport.await;
import static org.Aayush.navigation.testutil.RouterTestSupport.counting;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("StaticHandler Tests")
class StaticHandlerTest {
    private final AtomicInteger rootLoads = new AtomicInteger();
    private final AtomicInteger childLoads = new AtomicInteger();

    private RouteDefinition.RouteDefinitionBuilder root() {
        return RouteDefinition.builder()
                .id("root")
                .path("/")
                .hasErrorBoundary(true)
                .loader(counting(rootLoads, "root-data"));
    }

    private static DataRequest get(String href) {
        return DataRequest.builder()
                .origin("http://localhost")
                .path(Path.parse(href))
                .signal(AbortSignal.never())
                .build();
    }

    private static DataRequest post(String href, AbortSignal signal) {
        return DataRequest.builder()
                .origin("http://localhost")
                .path(Path.parse(href))
                .method(FormMethod.POST)
                .encType(FormEncType.URL_ENCODED)
                .formData(FormData.of("name", "value"))
                .signal(signal)
                .build();
    }

    private static StaticHandlerContext context(QueryResult result) {
        return assertInstanceOf(StaticHandlerContext.class, result);
    }

    // ========== query ==========

    @Test
    @DisplayName("GET query runs every matched loader")
    void testQueryLoadsMatches() {
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("contact")
                        .path("contacts/:contactId")
                        .loader(args -> "contact-" + args.param("contactId"))
                        .build())
                .build()));

        StaticHandlerContext context = context(await(handler.query(get("/contacts/7?tab=notes"))));

        assertEquals("/contacts/7", context.getLocation().getPathname());
        assertEquals("?tab=notes", context.getLocation().getSearch());
        assertEquals(2, context.getMatches().size());
        assertEquals(Map.of("root", "root-data", "contact", "contact-7"), context.getLoaderData());
        assertTrue(context.getErrors().isEmpty());
        assertNull(context.getActionData());
        assertEquals(200, context.getStatusCode());
    }

    @Test
    @DisplayName("Unmatched path yields a 404 context without running loaders")
    void testQueryNotFound() {
        StaticHandler handler = new StaticHandler(List.of(root().build()));

        StaticHandlerContext context = context(await(handler.query(get("/missing"))));

        assertEquals(404, context.getStatusCode());
        ErrorResponse error = assertInstanceOf(ErrorResponse.class, context.getErrors().get("root"));
        assertEquals(404, error.getStatus());
        assertEquals(0, rootLoads.get());
    }

    @Test
    @DisplayName("Thrown error responses land at the boundary and set the status")
    void testQueryLoaderErrorStatus() {
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("gone")
                        .path("gone")
                        .loader(args -> {
                            throw new DataResponseException(DataResponse.builder()
                                    .status(410)
                                    .statusText("Gone")
                                    .body("removed")
                                    .build());
                        })
                        .build())
                .build()));

        StaticHandlerContext context = context(await(handler.query(get("/gone"))));

        assertEquals(410, context.getStatusCode());
        ErrorResponse error = assertInstanceOf(ErrorResponse.class, context.getErrors().get("root"));
        assertEquals("removed", error.getData());
        assertEquals("root-data", context.getLoaderData().get("root"));
    }

    @Test
    @DisplayName("Loader headers are kept per route")
    void testQueryLoaderHeaders() {
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("cached")
                        .path("cached")
                        .loader(args -> DataResponse.builder()
                                .header("Cache-Control", "max-age=60")
                                .body("fresh")
                                .build())
                        .build())
                .build()));

        StaticHandlerContext context = context(await(handler.query(get("/cached"))));

        assertEquals("fresh", context.getLoaderData().get("cached"));
        assertEquals(Map.of("cached", Map.of("Cache-Control", "max-age=60")), context.getLoaderHeaders());
    }

    @Test
    @DisplayName("Redirects come back resolved against the redirecting route")
    void testQueryRedirectIsRaw() {
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("a")
                        .path("a")
                        .loader(args -> DataResponse.redirect("child"))
                        .build())
                .build()));

        QueryResult result = await(handler.query(get("/a")));

        QueryResult.RawResponse raw = assertInstanceOf(QueryResult.RawResponse.class, result);
        assertEquals(302, raw.response().getStatus());
        assertEquals("/a/child", raw.response().header(DataResponse.LOCATION));
    }

    @Test
    @DisplayName("Mutation runs the action then reloads with a GET request")
    void testQuerySubmission() {
        AtomicReference<FormMethod> loaderMethod = new AtomicReference<>();
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("form")
                        .path("form")
                        .action(args -> DataResponse.builder()
                                .status(201)
                                .header("X-Saved", "1")
                                .body("saved-" + args.getRequest().getFormData().get("name"))
                                .build())
                        .loader(args -> {
                            loaderMethod.set(args.getRequest().getMethod());
                            return "form-data";
                        })
                        .build())
                .build()));

        StaticHandlerContext context = context(await(handler.query(post("/form", AbortSignal.never()))));

        assertEquals(Map.of("form", "saved-value"), context.getActionData());
        assertEquals(Map.of("form", Map.of("X-Saved", "1")), context.getActionHeaders());
        assertEquals(201, context.getStatusCode());
        assertEquals("form-data", context.getLoaderData().get("form"));
        assertEquals(FormMethod.GET, loaderMethod.get());
    }

    @Test
    @DisplayName("Submitting to a route without an action yields 405 at the boundary")
    void testQueryMethodNotAllowed() {
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("plain")
                        .path("plain")
                        .loader(counting(childLoads, "plain-data"))
                        .build())
                .build()));

        StaticHandlerContext context = context(await(handler.query(post("/plain", AbortSignal.never()))));

        assertEquals(405, context.getStatusCode());
        assertEquals(405, assertInstanceOf(ErrorResponse.class, context.getErrors().get("root")).getStatus());
        assertEquals(0, rootLoads.get());
        assertEquals(0, childLoads.get());
    }

    @Test
    @DisplayName("Action errors only reload the loaders above their boundary")
    void testQueryActionError() {
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("section")
                        .path("section")
                        .hasErrorBoundary(true)
                        .loader(counting(childLoads, "section-data"))
                        .child(RouteDefinition.builder()
                                .id("edit")
                                .path("edit")
                                .action(args -> {
                                    throw new IllegalArgumentException("bad input");
                                })
                                .build())
                        .build())
                .build()));

        StaticHandlerContext context = context(await(handler.query(post("/section/edit", AbortSignal.never()))));

        assertEquals(500, context.getStatusCode());
        assertInstanceOf(IllegalArgumentException.class, context.getErrors().get("section"));
        assertNull(context.getActionData());
        assertEquals(1, rootLoads.get());
        assertEquals(0, childLoads.get());
        assertFalse(context.getLoaderData().containsKey("section"));
    }

    @Test
    @DisplayName("Aborted requests fail the query")
    void testQueryAborted() {
        AbortController controller = new AbortController();
        controller.abort();
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("form")
                        .path("form")
                        .action(args -> "saved")
                        .build())
                .build()));

        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> await(handler.query(post("/form", controller.signal())))
        );
        assertEquals("query() call aborted", ex.getMessage());
    }

    @Test
    @DisplayName("Empty route list is rejected with a reason code")
    void testEmptyRoutesRejected() {
        RouteConfigurationException ex = assertThrows(RouteConfigurationException.class, () -> new StaticHandler(List.of()));
        assertEquals(RouteConfigurationException.REASON_EMPTY_ROUTES, ex.reasonCode());
    }

    // ========== queryRoute ==========

    @Test
    @DisplayName("Single-route query runs only that loader")
    void testQueryRouteLoader() {
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("child")
                        .path("child")
                        .loader(counting(childLoads, "child-data"))
                        .build())
                .build()));

        assertEquals("child-data", await(handler.queryRoute(get("/child"), null)));
        assertEquals("root-data", await(handler.queryRoute(get("/child"), "root")));
        assertEquals(1, rootLoads.get());
        assertEquals(1, childLoads.get());
    }

    @Test
    @DisplayName("Single-route query returns action data")
    void testQueryRouteAction() {
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("form")
                        .path("form")
                        .action(args -> "saved")
                        .build())
                .build()));

        assertEquals("saved", await(handler.queryRoute(post("/form", AbortSignal.never()), "form")));
        assertEquals(0, rootLoads.get());
    }

    @Test
    @DisplayName("Unknown paths and routes fail with a router-marked 404")
    void testQueryRouteNotFound() {
        StaticHandler handler = new StaticHandler(List.of(root().build()));

        DataResponseException missingPath = assertThrows(
                DataResponseException.class, () -> await(handler.queryRoute(get("/missing"), null)));
        assertEquals(404, missingPath.getResponse().getStatus());
        assertEquals("yes", missingPath.getResponse().header(StaticHandler.ROUTER_ERROR_HEADER));

        DataResponseException missingRoute = assertThrows(
                DataResponseException.class, () -> await(handler.queryRoute(get("/"), "nope")));
        assertEquals(404, missingRoute.getResponse().getStatus());
    }

    @Test
    @DisplayName("Single-route submission without an action fails with a router-marked 405")
    void testQueryRouteMethodNotAllowed() {
        StaticHandler handler = new StaticHandler(List.of(root().build()));

        DataResponseException ex = assertThrows(
                DataResponseException.class, () -> await(handler.queryRoute(post("/", AbortSignal.never()), "root")));
        assertEquals(405, ex.getResponse().getStatus());
        assertEquals("yes", ex.getResponse().header(StaticHandler.ROUTER_ERROR_HEADER));
    }

    @Test
    @DisplayName("Responses thrown by route code are rethrown untouched")
    void testQueryRouteThrownResponse() {
        DataResponse forbidden = DataResponse.builder().status(403).body("no").build();
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("secret")
                        .path("secret")
                        .loader(args -> {
                            throw new DataResponseException(forbidden);
                        })
                        .build())
                .build()));

        DataResponseException ex = assertThrows(
                DataResponseException.class, () -> await(handler.queryRoute(get("/secret"), null)));
        assertEquals(forbidden, ex.getResponse());
    }

    @Test
    @DisplayName("Errors thrown by route code are rethrown")
    void testQueryRouteError() {
        StaticHandler handler = new StaticHandler(List.of(root()
                .child(RouteDefinition.builder()
                        .id("broken")
                        .path("broken")
                        .loader(args -> {
                            throw new IllegalStateException("broken loader");
                        })
                        .build())
                .build()));

        IllegalStateException ex = assertThrows(
                IllegalStateException.class, () -> await(handler.queryRoute(get("/broken"), null)));
        assertEquals("broken loader", ex.getMessage());
    }
}
