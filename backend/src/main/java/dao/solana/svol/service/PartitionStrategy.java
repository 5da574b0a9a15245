package dao.solana.svol.service;

/**
 * How raw transfer sizes are drawn before they are scaled to the target volume.
 * One is picked at random per schedule so no single distribution shape dominates.
 */
public enum PartitionStrategy {
    LOG_NORMAL,
    PARETO,
    STICK_BREAKING
}
