package dao.solana.svol.service;

import dao.solana.svol.model.ScheduleRunResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on one execution of a schedule. The stop request is cooperative: the worker checks it
 * between transfers and wakes from its wait as soon as it is set.
 */
public class ScheduleRun {

    private final String scheduleId;
    private final Instant startedAt;
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CompletableFuture<ScheduleRunResult> result = new CompletableFuture<>();

    public ScheduleRun(String scheduleId, Clock clock) {
        this.scheduleId = scheduleId;
        this.startedAt = clock.instant();
    }

    public String getScheduleId() {
        return scheduleId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * @return true for the call that actually requested the stop
     */
    public boolean requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            stopSignal.countDown();
            return true;
        }
        return false;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Sleeps up to timeout.
     *
     * @return true if a stop was requested before the timeout elapsed
     */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        return stopSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public CompletableFuture<ScheduleRunResult> result() {
        return result;
    }

    public boolean isFinished() {
        return result.isDone();
    }

    void complete(ScheduleRunResult r) {
        result.complete(r);
    }

    void fail(Throwable error) {
        result.completeExceptionally(error);
    }
}
