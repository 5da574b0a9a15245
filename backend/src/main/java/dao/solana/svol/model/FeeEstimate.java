package dao.solana.svol.model;

import java.time.Instant;

/**
 * One fee reading. Recomputed per request, never stored.
 */
public record FeeEstimate(
        long feeUnits,
        Instant observedAt,
        boolean spike
) {}
