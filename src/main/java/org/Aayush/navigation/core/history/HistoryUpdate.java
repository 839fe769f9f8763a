package org.Aayush.navigation.core.history;

/**
 * Notification emitted by a history when its current entry changes outside the router.
 *
 * @param action action that caused the change.
 * @param location new current location.
 */
public record HistoryUpdate(HistoryAction action, Location location) {
}
