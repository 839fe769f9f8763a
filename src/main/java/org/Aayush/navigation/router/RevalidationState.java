package org.Aayush.navigation.router;

/**
 * Whether a manual revalidation is in progress.
 */
public enum RevalidationState {
    IDLE,
    LOADING
}
