package io.github.drompincen.taskboard.engine.store;

public record MergeResult(int added, int updated, int removed, int preservedInFlight) {

    public boolean changed() {
        return added > 0 || updated > 0 || removed > 0;
    }
}
