package org.Aayush.navigation.router;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.navigation.core.history.NavigationHistory;
import org.Aayush.navigation.data.JsonBodyCodec;
import org.Aayush.navigation.graph.RouteDefinition;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Construction parameters of a {@link NavigationRouter}.
 *
 * <p>When no executor is supplied the router owns a single daemon thread. A supplied
 * executor must run tasks one at a time in submission order.</p>
 */
@Value
@Builder
public class RouterInit {
    static final String PROP_BASENAME = "taro.navigation.basename";
    static final String PROP_ORIGIN = "taro.navigation.origin";
    static final String DEFAULT_BASENAME = "/";
    static final String DEFAULT_ORIGIN = "unknown://unknown";

    @Singular
    List<RouteDefinition> routes;
    @NonNull
    NavigationHistory history;
    @Builder.Default
    String basename = defaultBasename();
    HydrationState hydrationData;
    Executor executor;
    /** Scheme and authority prefixed to request URLs handed to loaders. */
    @Builder.Default
    String origin = defaultOrigin();
    @Builder.Default
    JsonBodyCodec jsonCodec = JsonBodyCodec.defaults();

    /**
     * Basename from {@code taro.navigation.basename}, or {@code /}.
     */
    public static String defaultBasename() {
        return readProperty(PROP_BASENAME, DEFAULT_BASENAME);
    }

    /**
     * Request origin from {@code taro.navigation.origin}, or {@code unknown://unknown}.
     */
    public static String defaultOrigin() {
        return readProperty(PROP_ORIGIN, DEFAULT_ORIGIN);
    }

    private static String readProperty(String property, String fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }
}
