package io.github.drompincen.taskboard.engine;

/**
 * Handle for cancelling a listener registration.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
