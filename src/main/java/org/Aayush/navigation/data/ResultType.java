package org.Aayush.navigation.data;

/**
 * Discriminator of {@link DataResult} variants.
 */
public enum ResultType {
    DATA,
    DEFERRED,
    REDIRECT,
    ERROR,
    CANCELLED
}
