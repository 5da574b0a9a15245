package dao.solana.svol.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One scheduled transfer.
 * <p>
 * Status only moves forward: PENDING -> IN_PROGRESS -> COMPLETED | FAILED.
 * Once terminal, nothing on the transfer changes any more.
 */
@Getter
@ToString
public class TransferOp {

    private final String from;
    private final String to;
    private BigDecimal amount;
    private final String tokenMint;
    private final int tokenDecimals;
    private final Instant scheduledAt;
    private final boolean serviceFee;

    private String scheduleId;
    private Instant executedAt;
    private TransferStatus status = TransferStatus.PENDING;
    private String txHash;
    private int retryCount;
    private Long feeLamports;
    private String errorMessage;

    public TransferOp(String from, String to, BigDecimal amount, String tokenMint, int tokenDecimals,
                      Instant scheduledAt, boolean serviceFee) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        if (from.equals(to)) {
            throw new IllegalArgumentException("Sender and receiver must differ: " + from);
        }
        this.tokenMint = Objects.requireNonNull(tokenMint, "tokenMint");
        this.scheduledAt = Objects.requireNonNull(scheduledAt, "scheduledAt");
        this.tokenDecimals = tokenDecimals;
        this.serviceFee = serviceFee;
        this.amount = requirePositive(amount);
    }

    public TransferOp(String from, String to, BigDecimal amount, String tokenMint, int tokenDecimals, Instant scheduledAt) {
        this(from, to, amount, tokenMint, tokenDecimals, scheduledAt, false);
    }

    void attachTo(String scheduleId) {
        this.scheduleId = scheduleId;
    }

    /**
     * Replace the amount. Only allowed before execution starts.
     */
    public void rescale(BigDecimal newAmount) {
        requireStatus(TransferStatus.PENDING, "rescale");
        this.amount = requirePositive(newAmount);
    }

    public void markInProgress() {
        requireStatus(TransferStatus.PENDING, "start");
        this.status = TransferStatus.IN_PROGRESS;
    }

    public void markCompleted(String txHash, Instant at) {
        requireStatus(TransferStatus.IN_PROGRESS, "complete");
        this.txHash = txHash;
        this.executedAt = at;
        this.errorMessage = null;
        this.status = TransferStatus.COMPLETED;
    }

    public void markFailed(String errorMessage, Instant at) {
        requireStatus(TransferStatus.IN_PROGRESS, "fail");
        this.errorMessage = errorMessage;
        this.executedAt = at;
        this.status = TransferStatus.FAILED;
    }

    public void recordAttempt(Long feeLamports, int retryCount) {
        requireStatus(TransferStatus.IN_PROGRESS, "record attempt on");
        this.feeLamports = feeLamports;
        this.retryCount = retryCount;
    }

    public boolean isPending() {
        return status == TransferStatus.PENDING;
    }

    private void requireStatus(TransferStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException("Cannot " + action + " transfer in status " + status
                    + " (from=" + from + ", to=" + to + ")");
        }
    }

    private static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Transfer amount must be positive, got " + amount);
        }
        return amount;
    }
}
