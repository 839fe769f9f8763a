package org.Aayush.navigation.core.history;

/**
 * Kind of change applied to the history stack.
 *
 * <p>{@code POP} is the default for freshly created histories and for back/forward
 * traversal. {@code PUSH} appends an entry, {@code REPLACE} overwrites the current one.</p>
 */
public enum HistoryAction {
    POP,
    PUSH,
    REPLACE
}
