package dao.solana.svol.service;

import dao.solana.svol.config.SchedulerProperties;
import dao.solana.svol.model.Schedule;
import dao.solana.svol.model.ScheduleRunResult;
import dao.solana.svol.model.ScheduleStatus;
import dao.solana.svol.repository.InMemoryScheduleRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleRunServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    @Mock
    private ScheduleExecutor scheduleExecutor;

    private InMemoryScheduleRepository repository;
    private ScheduleRunService runService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryScheduleRepository();
        runService = new ScheduleRunService(scheduleExecutor, repository, new SchedulerProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        runService.shutdown();
    }

    private static Schedule schedule(String id) {
        return new Schedule(id, "mother", List.of("a", "b"), "mint", 6, BigDecimal.ONE, BigDecimal.ZERO, NOW);
    }

    @Test
    @DisplayName("Test started run completes with the executor's result and the schedule is saved")
    void testStart() throws Exception {
        // Arrange
        Schedule schedule = schedule("s-1");
        ScheduleRunResult expected = new ScheduleRunResult("s-1", ScheduleStatus.COMPLETED, 0, 0, 0, false, 1);
        when(scheduleExecutor.run(any(), any())).thenReturn(expected);

        // Act
        ScheduleRun run = runService.start(schedule);

        // Assert
        assertEquals(expected, run.result().get(5, TimeUnit.SECONDS));
        assertTrue(run.isFinished());
        assertTrue(repository.findById("s-1").isPresent());
        assertTrue(runService.activeRuns().isEmpty());
        assertSame(run, runService.find("s-1").orElseThrow());
    }

    @Test
    @DisplayName("Test a schedule cannot be started twice")
    void testDuplicateStart() {
        Schedule schedule = schedule("s-2");
        when(scheduleExecutor.run(any(), any())).thenAnswer(inv -> {
            ScheduleRun run = inv.getArgument(1);
            run.awaitStop(Duration.ofSeconds(5));
            return new ScheduleRunResult("s-2", ScheduleStatus.FAILED, 0, 0, 0, true, 1);
        });

        runService.start(schedule);

        assertThrows(IllegalStateException.class, () -> runService.start(schedule));
        assertTrue(runService.stop("s-2"));
        assertFalse(runService.stop("s-2"));
    }

    @Test
    @DisplayName("Test only pending schedules can be started")
    void testStartRequiresPending() {
        Schedule schedule = schedule("s-3");
        schedule.markInProgress();

        assertThrows(IllegalStateException.class, () -> runService.start(schedule));
        assertFalse(runService.stop("s-3"));
    }

    @Test
    @DisplayName("Test a crashing run completes its result exceptionally")
    void testCrashedRun() {
        when(scheduleExecutor.run(any(), any())).thenThrow(new IllegalStateException("boom"));

        ScheduleRun run = runService.start(schedule("s-4"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> run.result().get(5, TimeUnit.SECONDS));
        assertEquals("boom", e.getCause().getMessage());
    }
}
