package dao.solana.svol.event;

public enum EventType {
    TRANSACTION_SENT,
    TRANSACTION_CONFIRMED,
    TRANSACTION_FAILED,
    TRANSACTION_RETRY,
    APPROVAL_REQUESTED,
    SCHEDULE_PROGRESS
}
