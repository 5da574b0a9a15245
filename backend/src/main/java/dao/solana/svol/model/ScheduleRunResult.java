package dao.solana.svol.model;

/**
 * Aggregate of one pass over a schedule. Per-transfer detail stays on the schedule's transfers.
 */
public record ScheduleRunResult(
        String scheduleId,
        ScheduleStatus status,
        int successful,
        int failed,
        int notExecuted,
        boolean stopped,
        long elapsedMs
) {}
