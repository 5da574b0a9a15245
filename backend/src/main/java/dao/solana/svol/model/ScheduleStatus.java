package dao.solana.svol.model;

public enum ScheduleStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
