package dao.solana.svol.model;

public enum ExecutionOutcome {
    CONFIRMED,
    FAILED,
    /** Rejected at the fee spike approval gate; never retried. */
    ABORTED
}
