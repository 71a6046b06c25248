package io.github.drompincen.taskboard.engine.schedule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorBoardSchedulerTest {

    @Test
    void tasksRunInSubmissionOrderOnOneThread() throws Exception {
        try (ExecutorBoardScheduler scheduler = new ExecutorBoardScheduler("board-test")) {
            List<String> threads = new CopyOnWriteArrayList<>();
            List<Integer> order = new CopyOnWriteArrayList<>();
            CountDownLatch done = new CountDownLatch(3);
            for (int i = 0; i < 3; i++) {
                int n = i;
                scheduler.execute(() -> {
                    threads.add(Thread.currentThread().getName());
                    order.add(n);
                    done.countDown();
                });
            }

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(order).containsExactly(0, 1, 2);
            assertThat(threads).containsOnly("board-test");
        }
    }

    @Test
    void periodicTaskSurvivesAnException() throws Exception {
        try (ExecutorBoardScheduler scheduler = new ExecutorBoardScheduler("board-test")) {
            CountDownLatch ticks = new CountDownLatch(3);
            Cancellable timer = scheduler.scheduleAtFixedRate(() -> {
                ticks.countDown();
                throw new IllegalStateException("tick failed");
            }, Duration.ZERO, Duration.ofMillis(10));

            assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
            timer.cancel();
        }
    }

    @Test
    void closeRunsQueuedWorkAndDropsTimers() {
        ExecutorBoardScheduler scheduler = new ExecutorBoardScheduler("board-test");
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean queuedRan = new AtomicBoolean();
        AtomicBoolean timerRan = new AtomicBoolean();
        scheduler.execute(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        scheduler.execute(() -> queuedRan.set(true));
        scheduler.schedule(() -> timerRan.set(true), Duration.ofMinutes(1));
        scheduler.scheduleAtFixedRate(() -> timerRan.set(true), Duration.ofMinutes(1), Duration.ofMinutes(1));

        release.countDown();
        long start = System.nanoTime();
        scheduler.close();

        assertThat(queuedRan).isTrue();
        assertThat(timerRan).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void closeInterruptsWorkThatOutlivesTheTimeout() throws Exception {
        ExecutorBoardScheduler scheduler = new ExecutorBoardScheduler("board-test", Duration.ofMillis(50));
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        scheduler.execute(() -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.close();

        Thread.sleep(200);
        assertThat(interrupted).isTrue();
    }
}
