package org.Aayush.navigation.data;

/**
 * Route-level override of the default revalidation decision.
 *
 * <p>Routes without a predicate use {@link ShouldRevalidateArgs#isDefaultShouldRevalidate()}.</p>
 */
@FunctionalInterface
public interface RevalidationPredicate {

    /**
     * Decides whether the route's loader runs again.
     *
     * @param args current/next URL and params, submission fields, action result and the
     *             computed default.
     */
    boolean shouldRevalidate(ShouldRevalidateArgs args);
}
