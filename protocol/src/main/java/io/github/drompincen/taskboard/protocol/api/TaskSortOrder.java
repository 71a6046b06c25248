package io.github.drompincen.taskboard.protocol.api;

/**
 * Ordering applied by the backend to a filtered task fetch. {@link #NONE} still orders by
 * creation time so repeated fetches come back in a stable order.
 */
public enum TaskSortOrder {
    NONE, CREATED_DATE, DUE_DATE, TITLE
}
