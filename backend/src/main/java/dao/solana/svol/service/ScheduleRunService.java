package dao.solana.svol.service;

import dao.solana.svol.config.SchedulerProperties;
import dao.solana.svol.model.Schedule;
import dao.solana.svol.model.ScheduleRunResult;
import dao.solana.svol.model.ScheduleStatus;
import dao.solana.svol.repository.ScheduleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs schedules as independent tasks on a bounded pool, one task per schedule.
 */
@Slf4j
@Service
public class ScheduleRunService {

    private final ScheduleExecutor scheduleExecutor;
    private final ScheduleRepository repository;
    private final Clock clock;
    private final ExecutorService executor;
    private final Map<String, ScheduleRun> runs = new ConcurrentHashMap<>();

    public ScheduleRunService(ScheduleExecutor scheduleExecutor,
                              ScheduleRepository repository,
                              SchedulerProperties schedulerProps,
                              Clock clock) {
        this.scheduleExecutor = scheduleExecutor;
        this.repository = repository;
        this.clock = clock;
        int threadSize = Math.max(1, schedulerProps.getExecution().getMaxParallelRuns());
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threadSize, r -> {
            Thread t = new Thread(r, "schedule-run-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue a pending schedule for execution. The schedule is IN_PROGRESS once this returns.
     *
     * @throws IllegalStateException if the schedule is not pending or already has a run
     */
    public ScheduleRun start(Schedule schedule) {
        ScheduleRun run = new ScheduleRun(schedule.getId(), clock);
        // claimed under the schedule lock so a concurrent funding adjustment sees it as started
        synchronized (schedule) {
            if (schedule.getStatus() != ScheduleStatus.PENDING) {
                throw new IllegalStateException("Schedule " + schedule.getId() + " is " + schedule.getStatus() + ", not PENDING");
            }
            ScheduleRun existing = runs.putIfAbsent(schedule.getId(), run);
            if (existing != null) {
                throw new IllegalStateException("Schedule " + schedule.getId() + " has already been started");
            }
            schedule.markInProgress();
        }

        executor.submit(() -> {
            try {
                ScheduleRunResult result = scheduleExecutor.run(schedule, run);
                repository.save(schedule);
                run.complete(result);
            } catch (Exception e) {
                log.error("Schedule {} run crashed", schedule.getId(), e);
                run.fail(e);
            }
        });
        log.info("Schedule {} queued for execution ({} transfers)", schedule.getId(), schedule.getTransfers().size());
        return run;
    }

    /**
     * @return false if the schedule has no run or was already asked to stop
     */
    public boolean stop(String scheduleId) {
        ScheduleRun run = runs.get(scheduleId);
        if (run == null) return false;
        boolean requested = run.requestStop();
        if (requested) {
            log.info("Stop requested for schedule {}", scheduleId);
        }
        return requested;
    }

    public Optional<ScheduleRun> find(String scheduleId) {
        return Optional.ofNullable(runs.get(scheduleId));
    }

    public List<ScheduleRun> activeRuns() {
        return runs.values().stream().filter(r -> !r.isFinished()).toList();
    }

    @jakarta.annotation.PreDestroy
    public void shutdown() {
        runs.values().forEach(ScheduleRun::requestStop);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
