package io.github.drompincen.taskboard.engine.schedule;

import java.time.Duration;

/**
 * The single logical timeline every board mutation runs on. Implementations must never run two
 * submitted tasks at the same time; store updates, backend completions and timer ticks are all
 * interleaved here instead of racing on shared state.
 */
public interface BoardScheduler {

    void execute(Runnable task);

    Cancellable schedule(Runnable task, Duration delay);

    Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);
}
