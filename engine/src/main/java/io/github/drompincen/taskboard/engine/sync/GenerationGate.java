package io.github.drompincen.taskboard.engine.sync;

/**
 * Orders asynchronous task-set responses. Each request takes a strictly increasing generation when it
 * is issued; a response may only be applied if nothing newer has been applied already and it was not
 * issued before the last scope change. Responses are therefore resolved in generation order, never in
 * arrival order, whatever transport delivers them.
 * <p>
 * Confined to the board timeline like the store it guards.
 */
public class GenerationGate {

    private long issued;
    private long applied;
    private long floor;

    public long next() {
        return ++issued;
    }

    public boolean isCurrent(long generation) {
        return generation >= floor && generation > applied;
    }

    public boolean tryApply(long generation) {
        if (!isCurrent(generation)) {
            return false;
        }
        applied = generation;
        return true;
    }

    /**
     * Makes every generation issued so far discardable.
     */
    public void invalidateOutstanding() {
        floor = issued + 1;
    }

    public long issuedGeneration() {
        return issued;
    }

    public long appliedGeneration() {
        return applied;
    }
}
