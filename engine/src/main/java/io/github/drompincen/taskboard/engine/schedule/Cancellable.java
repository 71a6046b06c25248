package io.github.drompincen.taskboard.engine.schedule;

@FunctionalInterface
public interface Cancellable {
    void cancel();
}
