package dao.solana.svol.service;

import dao.solana.svol.chain.FeeSampleSource;
import dao.solana.svol.config.FeeProperties;
import dao.solana.svol.model.FeeEstimate;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rolling window of recent fee samples.
 * <p>
 * Answers three questions: what fee to use now, whether a fee is a spike, and how far to raise
 * the fee on a retry. The window is the only state shared between concurrent schedule runs:
 * readers work on an immutable snapshot, appends are serialized and publish a new snapshot.
 */
@Slf4j
public class FeeOracle {

    private static final BigDecimal RETRY_STEP = new BigDecimal("0.25");
    private static final int MAX_ESCALATION_ATTEMPT = 3;

    private final FeeSampleSource source;
    private final int windowSize;
    private final long defaultFee;
    private final BigDecimal safetyMargin;
    private final BigDecimal spikeThreshold;
    private final Clock clock;

    private final Deque<Long> samples = new ArrayDeque<>();
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    public FeeOracle(FeeSampleSource source, int windowSize, long defaultFee,
                     BigDecimal safetyMargin, BigDecimal spikeThreshold, Clock clock) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got " + windowSize);
        }
        if (defaultFee < 0) {
            throw new IllegalArgumentException("defaultFee must be >= 0, got " + defaultFee);
        }
        if (spikeThreshold == null || spikeThreshold.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException("spikeThreshold must be >= 1.0, got " + spikeThreshold);
        }
        if (safetyMargin == null || safetyMargin.signum() <= 0) {
            throw new IllegalArgumentException("safetyMargin must be > 0, got " + safetyMargin);
        }
        this.source = source;
        this.windowSize = windowSize;
        this.defaultFee = defaultFee;
        this.safetyMargin = safetyMargin;
        this.spikeThreshold = spikeThreshold;
        this.clock = clock;
    }

    public FeeOracle(FeeSampleSource source, FeeProperties.Oracle props, Clock clock) {
        this(source, props.getWindowSize(), props.getDefaultFee(), props.getSafetyMargin(),
                props.getSpikeThreshold(), clock);
    }

    /**
     * Append a sample, evicting the oldest one once the window is full.
     */
    public void recordObservation(long feeUnits) {
        if (feeUnits < 0) {
            throw new IllegalArgumentException("Fee sample must be >= 0, got " + feeUnits);
        }
        synchronized (samples) {
            samples.addLast(feeUnits);
            while (samples.size() > windowSize) {
                samples.removeFirst();
            }
            snapshot.set(Snapshot.of(samples));
        }
    }

    /**
     * round_half_up(mean * safetyMargin), or the default fee while the window is empty.
     */
    public long recommendedFee() {
        Snapshot s = snapshot.get();
        if (s.isEmpty()) return defaultFee;
        return s.mean().multiply(safetyMargin).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /**
     * Strictly greater than max(mean, defaultFee) * spikeThreshold. A fee exactly at the threshold
     * is not a spike. The floor keeps a window of zero priority fees from turning every paid fee
     * into a spike.
     */
    public boolean isSpike(long candidateFee) {
        return BigDecimal.valueOf(candidateFee).compareTo(spikeLimit()) > 0;
    }

    /**
     * previousFee * (1 + 0.25 * 2^(min(attempt, 3) - 1)): +25%, +50%, +100%, then flat.
     */
    public long feeForRetry(long previousFee, int retryAttempt) {
        if (retryAttempt <= 0) return previousFee;
        int exponent = Math.min(retryAttempt, MAX_ESCALATION_ATTEMPT) - 1;
        BigDecimal multiplier = BigDecimal.ONE.add(RETRY_STEP.multiply(BigDecimal.valueOf(1L << exponent)));
        return BigDecimal.valueOf(previousFee).multiply(multiplier)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    /**
     * Pull a fresh sample, judge it against the window as it was before the sample, then record it.
     * When the source is unavailable the recommended fee is returned and nothing is recorded.
     */
    public FeeEstimate currentEstimate() {
        long sample;
        try {
            sample = source.latestFeeSample();
        } catch (RuntimeException e) {
            long fallback = recommendedFee();
            log.warn("Fee source unavailable ({}), using recommended fee {}", e.getMessage(), fallback);
            return new FeeEstimate(fallback, clock.instant(), false);
        }
        boolean spike = isSpike(sample);
        recordObservation(sample);
        if (spike) {
            log.warn("Fee spike observed: sample={}, average={}, threshold={}",
                    sample, averageFee().toPlainString(), spikeThreshold.toPlainString());
        }
        return new FeeEstimate(sample, clock.instant(), spike);
    }

    /**
     * Periodic refresh. Never throws; a failed pull just leaves the window as it was.
     */
    public void refresh() {
        try {
            long sample = source.latestFeeSample();
            recordObservation(sample);
            log.debug("Fee sample recorded: {} (window={})", sample, sampleCount());
        } catch (Exception e) {
            log.warn("Fee refresh failed: {}", e.getMessage());
        }
    }

    /**
     * Mean of the window; the default fee while empty.
     */
    public BigDecimal averageFee() {
        Snapshot s = snapshot.get();
        return s.isEmpty() ? BigDecimal.valueOf(defaultFee) : s.mean();
    }

    public BigDecimal spikeLimit() {
        return averageFee().max(BigDecimal.valueOf(defaultFee)).multiply(spikeThreshold);
    }

    public BigDecimal getSpikeThreshold() {
        return spikeThreshold;
    }

    public int sampleCount() {
        return snapshot.get().samples().size();
    }

    public List<Long> samples() {
        return snapshot.get().samples();
    }

    private record Snapshot(List<Long> samples, long sum) {

        static final Snapshot EMPTY = new Snapshot(List.of(), 0L);

        static Snapshot of(Deque<Long> window) {
            List<Long> copy = List.copyOf(new ArrayList<>(window));
            long sum = 0;
            for (long v : copy) sum = Math.addExact(sum, v);
            return new Snapshot(copy, sum);
        }

        boolean isEmpty() {
            return samples.isEmpty();
        }

        BigDecimal mean() {
            return BigDecimal.valueOf(sum).divide(BigDecimal.valueOf(samples.size()), MathContext.DECIMAL64);
        }
    }
}
