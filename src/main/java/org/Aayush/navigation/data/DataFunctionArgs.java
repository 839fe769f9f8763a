package org.Aayush.navigation.data;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Arguments handed to a {@link DataFunction}.
 */
@Value
@Builder
public class DataFunctionArgs {
    @NonNull
    DataRequest request;
    @Singular
    Map<String, String> params;

    /**
     * Returns a captured param or null.
     */
    public String param(String name) {
        return params.get(name);
    }
}
