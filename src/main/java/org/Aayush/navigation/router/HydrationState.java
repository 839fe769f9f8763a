package org.Aayush.navigation.router;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Data rendered ahead of time; supplying it marks the router initialized.
 */
@Value
@Builder
public class HydrationState {
    @Builder.Default
    Map<String, Object> loaderData = Map.of();
    @Builder.Default
    Map<String, Object> actionData = Map.of();
    @Builder.Default
    Map<String, Object> errors = Map.of();
}
