package dao.solana.svol.model;

/**
 * Terminal result of executing one transfer.
 */
public record TransferResult(
        ExecutionOutcome outcome,
        String txHash,
        Long feeUsed,
        int retryCount,
        long confirmationDurationMs,
        String reason
) {

    public static TransferResult confirmed(String txHash, long feeUsed, int retryCount, long confirmationDurationMs) {
        return new TransferResult(ExecutionOutcome.CONFIRMED, txHash, feeUsed, retryCount, confirmationDurationMs, null);
    }

    public static TransferResult failed(String reason, int retryCount) {
        return new TransferResult(ExecutionOutcome.FAILED, null, null, retryCount, 0L, reason);
    }

    public static TransferResult aborted(String reason) {
        return new TransferResult(ExecutionOutcome.ABORTED, null, null, 0, 0L, reason);
    }

    public boolean isConfirmed() {
        return outcome == ExecutionOutcome.CONFIRMED;
    }
}
