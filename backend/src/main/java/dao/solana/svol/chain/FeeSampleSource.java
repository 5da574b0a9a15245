package dao.solana.svol.chain;

/**
 * Where fresh fee observations come from.
 */
@FunctionalInterface
public interface FeeSampleSource {

    long latestFeeSample();
}
