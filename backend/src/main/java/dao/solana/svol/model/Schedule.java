package dao.solana.svol.model;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A set of transfers over one mother wallet's children.
 * <p>
 * Invariant: sum of non service-fee transfer amounts + serviceFeeTotal == totalVolume
 * (exact at token scale, the generator and fee collector both fold rounding residue into one transfer).
 */
@Getter
public class Schedule {

    private final String id;
    private final String motherWallet;
    private final List<String> childWallets;
    private final String tokenMint;
    private final int tokenDecimals;
    private final Instant createdAt;

    private BigDecimal totalVolume;
    private BigDecimal serviceFeeTotal;
    private volatile ScheduleStatus status = ScheduleStatus.PENDING;
    private volatile Instant completedAt;

    private final List<TransferOp> transfers = new ArrayList<>();

    public Schedule(String id, String motherWallet, List<String> childWallets, String tokenMint, int tokenDecimals,
                    BigDecimal totalVolume, BigDecimal serviceFeeTotal, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.motherWallet = motherWallet;
        this.childWallets = List.copyOf(childWallets);
        if (this.childWallets.size() < 2) {
            throw new IllegalArgumentException("A schedule needs at least 2 child wallets");
        }
        this.tokenMint = Objects.requireNonNull(tokenMint, "tokenMint");
        this.tokenDecimals = tokenDecimals;
        this.totalVolume = Objects.requireNonNull(totalVolume, "totalVolume");
        this.serviceFeeTotal = serviceFeeTotal == null ? BigDecimal.ZERO : serviceFeeTotal;
        this.createdAt = createdAt;
    }

    public List<TransferOp> getTransfers() {
        return Collections.unmodifiableList(transfers);
    }

    public void addTransfer(TransferOp op) {
        requirePending("add transfers to");
        op.attachTo(id);
        transfers.add(op);
    }

    public void addTransfers(List<TransferOp> ops) {
        ops.forEach(this::addTransfer);
    }

    public int removeTransfers(Predicate<TransferOp> filter) {
        requirePending("remove transfers from");
        int before = transfers.size();
        transfers.removeIf(filter);
        return before - transfers.size();
    }

    public void updateTotals(BigDecimal totalVolume, BigDecimal serviceFeeTotal) {
        requirePending("update totals of");
        this.totalVolume = Objects.requireNonNull(totalVolume, "totalVolume");
        this.serviceFeeTotal = Objects.requireNonNull(serviceFeeTotal, "serviceFeeTotal");
    }

    public BigDecimal nonFeeVolume() {
        return transfers.stream()
                .filter(t -> !t.isServiceFee())
                .map(TransferOp::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<TransferOp> regularTransfers() {
        return transfers.stream().filter(t -> !t.isServiceFee()).toList();
    }

    public void markInProgress() {
        this.status = ScheduleStatus.IN_PROGRESS;
    }

    /**
     * COMPLETED only when every transfer completed; anything else ends as FAILED.
     */
    public ScheduleStatus finish(Instant at) {
        boolean allCompleted = !transfers.isEmpty()
                && transfers.stream().allMatch(t -> t.getStatus() == TransferStatus.COMPLETED);
        this.status = allCompleted ? ScheduleStatus.COMPLETED : ScheduleStatus.FAILED;
        this.completedAt = at;
        return status;
    }

    public long countByStatus(TransferStatus s) {
        return transfers.stream().filter(t -> t.getStatus() == s).count();
    }

    private void requirePending(String action) {
        if (status != ScheduleStatus.PENDING) {
            throw new IllegalStateException("Cannot " + action + " schedule " + id + " in status " + status);
        }
    }
}
