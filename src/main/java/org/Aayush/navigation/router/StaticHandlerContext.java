package org.Aayush.navigation.router;

import lombok.Builder;
import lombok.Value;
import org.Aayush.navigation.core.history.Location;
import org.Aayush.navigation.matching.RouteMatch;

import java.util.List;
import java.util.Map;

/**
 * Data gathered by {@link StaticHandler#query} for one request: what a server renders.
 */
@Value
@Builder(toBuilder = true)
public class StaticHandlerContext implements QueryResult {
    Location location;
    List<RouteMatch> matches;
    @Builder.Default
    Map<String, Object> loaderData = Map.of();
    /** Action data by route id, or null when no action ran or it failed. */
    Map<String, Object> actionData;
    /** Errors by boundary route id; empty when there are none. */
    @Builder.Default
    Map<String, Object> errors = Map.of();
    @Builder.Default
    int statusCode = 200;
    @Builder.Default
    Map<String, Map<String, String>> loaderHeaders = Map.of();
    @Builder.Default
    Map<String, Map<String, String>> actionHeaders = Map.of();
}
