package dao.solana.svol.model;

import java.math.BigDecimal;

/**
 * What a user sees when asked to approve a transfer during a fee spike.
 */
public record ApprovalContext(
        String scheduleId,
        String from,
        String to,
        BigDecimal amount,
        String token,
        long estimatedFee,
        BigDecimal averageFee,
        BigDecimal spikeMultiplier
) {}
