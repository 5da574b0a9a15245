package dao.solana.svol.service;

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.ParetoDistribution;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Splits a volume, expressed in minimal token units, into distinct positive parts that sum
 * exactly to the volume.
 * <p>
 * Not thread-safe: the random generator is shared with the caller.
 */
public class AmountPartitioner {

    private static final double PARETO_SCALE = 1.0;
    private static final double BETA_ALPHA = 2.0;
    private static final double BETA_BETA = 3.0;

    private final RandomGenerator rng;
    private final double logNormalSigma;
    private final double paretoShape;

    public AmountPartitioner(RandomGenerator rng, double logNormalSigma, double paretoShape) {
        if (logNormalSigma <= 0) throw new IllegalArgumentException("logNormalSigma must be > 0");
        if (paretoShape <= 0) throw new IllegalArgumentException("paretoShape must be > 0");
        this.rng = rng;
        this.logNormalSigma = logNormalSigma;
        this.paretoShape = paretoShape;
    }

    public PartitionStrategy randomStrategy() {
        PartitionStrategy[] all = PartitionStrategy.values();
        return all[rng.nextInt(all.length)];
    }

    /**
     * Largest k such that 1 + 2 + ... + k fits into totalUnits, i.e. the most distinct
     * positive parts the volume can hold.
     */
    public static int maxDistinctParts(long totalUnits) {
        if (totalUnits < 1) return 0;
        long k = (long) Math.floor((Math.sqrt(8.0 * totalUnits + 1) - 1) / 2);
        while (k * (k + 1) / 2 > totalUnits) k--;
        while ((k + 1) * (k + 2) / 2 <= totalUnits) k++;
        return (int) Math.min(Integer.MAX_VALUE, k);
    }

    public long[] partition(long totalUnits, int count, PartitionStrategy strategy) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got " + count);
        }
        if (count > maxDistinctParts(totalUnits)) {
            throw new IllegalArgumentException(totalUnits + " units cannot hold " + count + " distinct positive parts");
        }
        double[] weights = draw(count, strategy);
        long[] units = scale(weights, totalUnits);
        makeDistinct(units);
        return units;
    }

    double[] draw(int count, PartitionStrategy strategy) {
        double[] w = new double[count];
        switch (strategy) {
            case LOG_NORMAL -> {
                LogNormalDistribution d = new LogNormalDistribution(rng, 0.0, logNormalSigma,
                        LogNormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
                for (int i = 0; i < count; i++) w[i] = d.sample();
            }
            case PARETO -> {
                ParetoDistribution d = new ParetoDistribution(rng, PARETO_SCALE, paretoShape,
                        ParetoDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
                for (int i = 0; i < count; i++) w[i] = d.sample();
            }
            case STICK_BREAKING -> {
                BetaDistribution d = new BetaDistribution(rng, BETA_ALPHA, BETA_BETA,
                        BetaDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
                double remaining = 1.0;
                for (int i = 0; i < count - 1; i++) {
                    w[i] = remaining * d.sample();
                    remaining -= w[i];
                }
                w[count - 1] = remaining;
            }
        }
        return w;
    }

    /**
     * Proportional split, every part floored at one unit. The residue goes to the largest part;
     * a negative residue is taken from the largest parts in turn, never below one unit.
     */
    static long[] scale(double[] weights, long totalUnits) {
        double sum = 0;
        for (double w : weights) sum += Math.max(w, 0);

        long[] units = new long[weights.length];
        long assigned = 0;
        for (int i = 0; i < weights.length; i++) {
            double share = sum > 0 ? Math.max(weights[i], 0) / sum : 1.0 / weights.length;
            units[i] = Math.max(1L, (long) Math.floor(share * totalUnits));
            assigned += units[i];
        }

        long residue = totalUnits - assigned;
        if (residue >= 0) {
            units[indexOfLargest(units)] += residue;
            return units;
        }
        while (residue < 0) {
            int largest = indexOfLargest(units);
            long take = Math.min(-residue, units[largest] - 1);
            if (take == 0) {
                throw new IllegalStateException("Cannot fit " + units.length + " parts into " + totalUnits + " units");
            }
            units[largest] -= take;
            residue += take;
        }
        return units;
    }

    /**
     * Each duplicate is raised just above its predecessor in ascending order, and the units this
     * costs are taken back from the top without breaking the ordering. The relative order of the
     * parts is kept and the total is unchanged.
     */
    static void makeDistinct(long[] units) {
        int n = units.length;
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingLong(i -> units[i]));

        long[] sorted = new long[n];
        for (int i = 0; i < n; i++) sorted[i] = units[order[i]];

        long excess = 0;
        for (int i = 1; i < n; i++) {
            if (sorted[i] <= sorted[i - 1]) {
                long need = sorted[i - 1] + 1 - sorted[i];
                sorted[i] += need;
                excess += need;
            }
        }
        while (excess > 0) {
            long before = excess;
            for (int j = n - 1; j >= 0 && excess > 0; j--) {
                long floor = j == 0 ? 1 : sorted[j - 1] + 1;
                long take = Math.min(excess, sorted[j] - floor);
                if (take > 0) {
                    sorted[j] -= take;
                    excess -= take;
                }
            }
            if (excess == before) {
                throw new IllegalStateException("Cannot make " + n + " parts distinct");
            }
        }

        for (int i = 0; i < n; i++) units[order[i]] = sorted[i];
    }

    private static int indexOfLargest(long[] units) {
        int best = 0;
        for (int i = 1; i < units.length; i++) {
            if (units[i] > units[best]) best = i;
        }
        return best;
    }
}
