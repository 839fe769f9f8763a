package org.Aayush.navigation.data;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.Aayush.navigation.core.history.Path;

import java.util.Map;

/**
 * Fixed argument set for {@link RevalidationPredicate}.
 */
@Value
@Builder
public class ShouldRevalidateArgs {
    @NonNull
    Path currentUrl;
    @NonNull
    Map<String, String> currentParams;
    @NonNull
    Path nextUrl;
    @NonNull
    Map<String, String> nextParams;

    /** Submission method, or null outside submissions. */
    FormMethod formMethod;
    String formAction;
    FormEncType formEncType;
    FormData formData;

    /** Data or error produced by the action of the current submission, if any. */
    Object actionResult;

    /** What the router would decide without a predicate. */
    boolean defaultShouldRevalidate;
}
