package dao.solana.svol.service;

import dao.solana.svol.config.SchedulerProperties;
import dao.solana.svol.config.TokenProperties;
import dao.solana.svol.exception.ScheduleValidationException;
import dao.solana.svol.model.Schedule;
import dao.solana.svol.model.ScheduleRequest;
import dao.solana.svol.model.TransferOp;
import dao.solana.svol.util.TokenAmounts;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Builds transfer schedules that look like independent trading activity: a random number of
 * transfers with distinct amounts drawn from one of several distributions, irregular (sometimes
 * clustered) gaps, and pairings that spread over all wallets.
 */
@Slf4j
@Service
public class ScheduleGenerator {

    private static final int MAX_DECIMALS = 18;

    private final SchedulerProperties.GenerationConfig config;
    private final int defaultDecimals;
    private final FeeCollector feeCollector;
    private final Clock clock;
    private final RandomGenerator rng;
    private final AmountPartitioner partitioner;

    @Autowired
    public ScheduleGenerator(SchedulerProperties schedulerProps, TokenProperties tokenProps,
                             FeeCollector feeCollector, Clock clock) {
        this(schedulerProps.getGeneration(), tokenProps.getDefaultDecimals(), feeCollector, clock, new Well19937c());
    }

    public ScheduleGenerator(SchedulerProperties.GenerationConfig config, int defaultDecimals,
                             FeeCollector feeCollector, Clock clock, RandomGenerator rng) {
        if (config.getClusterProbability() < 0 || config.getClusterProbability() > 1) {
            throw new IllegalArgumentException("clusterProbability must be in [0, 1]");
        }
        this.config = config;
        this.defaultDecimals = defaultDecimals;
        this.feeCollector = feeCollector;
        this.clock = clock;
        this.rng = rng;
        this.partitioner = new AmountPartitioner(rng, config.getLogNormalSigma(), config.getParetoShape());
    }

    public synchronized Schedule generateSchedule(ScheduleRequest request) {
        List<String> wallets = distinctWallets(request.getChildWallets());
        Integer walletCount = request.getWalletCount();
        if (walletCount != null) {
            if (walletCount > wallets.size()) {
                throw new ScheduleValidationException("Requested " + walletCount + " wallets but only "
                        + wallets.size() + " distinct addresses were supplied");
            }
            wallets = wallets.subList(0, walletCount);
        }
        if (wallets.size() < 2) {
            throw new ScheduleValidationException("At least 2 distinct wallets are required, got " + wallets.size());
        }

        int decimals = request.getTokenDecimals() != null ? request.getTokenDecimals() : defaultDecimals;
        BigDecimal totalVolume = requireVolume(request.getTotalVolume(), decimals);
        long minInterval = request.getMinIntervalSeconds() != null ? request.getMinIntervalSeconds() : config.getMinIntervalSeconds();
        long maxInterval = request.getMaxIntervalSeconds() != null ? request.getMaxIntervalSeconds() : config.getMaxIntervalSeconds();
        Instant start = request.getStartTime() != null ? Instant.ofEpochSecond(request.getStartTime()) : clock.instant();

        BigDecimal serviceFee = feeCollector.isEnabled()
                ? feeCollector.calculateFee(totalVolume, decimals)
                : BigDecimal.ZERO.setScale(decimals);
        BigDecimal distributable = totalVolume.subtract(serviceFee);
        if (distributable.signum() <= 0) {
            throw new ScheduleValidationException("Total volume " + totalVolume.toPlainString()
                    + " does not cover the service fee " + serviceFee.toPlainString());
        }

        List<TransferOp> transfers = generateTransfers(wallets, distributable, request.getTokenMint(),
                decimals, minInterval, maxInterval, start);

        Schedule schedule = new Schedule(UUID.randomUUID().toString(), request.getMotherWallet(), wallets,
                request.getTokenMint(), decimals, totalVolume, serviceFee, clock.instant());
        schedule.addTransfers(transfers);
        if (serviceFee.signum() > 0) {
            feeCollector.addFeeTransfers(schedule, serviceFee);
        }

        log.info("Schedule {} generated: wallets={}, transfers={}, volume={}, serviceFee={}, token={}",
                schedule.getId(), wallets.size(), transfers.size(), totalVolume.toPlainString(),
                serviceFee.toPlainString(), request.getTokenMint());
        return schedule;
    }

    /**
     * Transfers over wallets whose amounts sum exactly to totalVolume, timestamps strictly
     * increasing after start.
     */
    public synchronized List<TransferOp> generateTransfers(List<String> wallets, BigDecimal totalVolume, String tokenMint,
                                                           int decimals, long minIntervalSeconds, long maxIntervalSeconds,
                                                           Instant start) {
        List<String> distinct = distinctWallets(wallets);
        if (distinct.size() < 2) {
            throw new ScheduleValidationException("At least 2 distinct wallets are required, got " + distinct.size());
        }
        if (tokenMint == null || tokenMint.isBlank()) {
            throw new ScheduleValidationException("Token mint is required");
        }
        BigDecimal volume = requireVolume(totalVolume, decimals);
        if (minIntervalSeconds <= 0) {
            throw new ScheduleValidationException("minInterval must be > 0, got " + minIntervalSeconds);
        }
        if (maxIntervalSeconds < minIntervalSeconds) {
            throw new ScheduleValidationException("maxInterval " + maxIntervalSeconds
                    + " is below minInterval " + minIntervalSeconds);
        }

        long totalUnits = toUnits(volume, decimals);
        int count = transferCount(distinct.size(), totalUnits);
        PartitionStrategy strategy = partitioner.randomStrategy();
        long[] amounts = partitioner.partition(totalUnits, count, strategy);

        WalletPairSelector pairs = new WalletPairSelector(distinct, config.getRecentWalletWindow(), rng);
        List<TransferOp> out = new ArrayList<>(count);
        Instant at = start;
        for (long units : amounts) {
            at = at.plusSeconds(nextGap(minIntervalSeconds, maxIntervalSeconds));
            WalletPair pair = pairs.next();
            out.add(new TransferOp(pair.from(), pair.to(), TokenAmounts.fromBaseUnits(units, decimals),
                    tokenMint, decimals, at));
        }
        log.debug("Generated {} transfers with {} amounts over {} wallets", count, strategy, distinct.size());
        return out;
    }

    /**
     * Sum within one minimal unit of totalVolume, all amounts positive and distinct, no self-transfer.
     * Service fee transfers are left out of the sum and uniqueness checks.
     */
    public boolean verifyTransfers(List<TransferOp> transfers, BigDecimal totalVolume) {
        if (transfers.isEmpty()) {
            log.warn("Verification failed: no transfers");
            return false;
        }
        int decimals = transfers.get(0).getTokenDecimals();
        BigDecimal sum = BigDecimal.ZERO;
        Set<BigDecimal> seen = new HashSet<>();
        for (TransferOp t : transfers) {
            if (t.getAmount().signum() <= 0) {
                log.warn("Verification failed: non-positive amount {}", t.getAmount());
                return false;
            }
            if (t.getFrom().equals(t.getTo())) {
                log.warn("Verification failed: self transfer on {}", t.getFrom());
                return false;
            }
            if (t.isServiceFee()) continue;
            if (!seen.add(t.getAmount().stripTrailingZeros())) {
                log.warn("Verification failed: duplicate amount {}", t.getAmount().toPlainString());
                return false;
            }
            sum = sum.add(t.getAmount());
        }
        BigDecimal diff = sum.subtract(totalVolume).abs();
        if (diff.compareTo(TokenAmounts.minimalUnit(decimals)) > 0) {
            log.warn("Verification failed: sum {} differs from volume {}", sum.toPlainString(), totalVolume.toPlainString());
            return false;
        }
        return true;
    }

    /**
     * Uniform in [2n, max(2n, min(n^2, maxTransfers))], lowered to what the volume can hold as
     * distinct positive amounts.
     */
    int transferCount(int wallets, long totalUnits) {
        long lower = 2L * wallets;
        long upper = Math.max(lower, Math.min((long) wallets * wallets, config.getMaxTransfers()));
        long count = lower + (long) Math.floor(rng.nextDouble() * (upper - lower + 1));
        int feasible = AmountPartitioner.maxDistinctParts(totalUnits);
        if (count > feasible) {
            log.debug("Volume of {} units holds at most {} distinct amounts, lowering count from {}", totalUnits, feasible, count);
            count = feasible;
        }
        if (count < 2) {
            throw new ScheduleValidationException("Volume of " + totalUnits + " minimal units is too small for 2 distinct transfers");
        }
        return (int) count;
    }

    long nextGap(long minInterval, long maxInterval) {
        long upper = rng.nextDouble() < config.getClusterProbability()
                ? Math.min(2 * minInterval, maxInterval)
                : maxInterval;
        return minInterval + (long) Math.floor(rng.nextDouble() * (upper - minInterval + 1));
    }

    private static BigDecimal requireVolume(BigDecimal totalVolume, int decimals) {
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new ScheduleValidationException("Token decimals must be in 0.." + MAX_DECIMALS + ", got " + decimals);
        }
        if (totalVolume == null || totalVolume.signum() <= 0) {
            throw new ScheduleValidationException("Total volume must be positive, got " + totalVolume);
        }
        if (totalVolume.stripTrailingZeros().scale() > decimals) {
            throw new ScheduleValidationException("Total volume " + totalVolume.toPlainString()
                    + " has more than " + decimals + " fractional digits");
        }
        return totalVolume.setScale(decimals, RoundingMode.UNNECESSARY);
    }

    private static long toUnits(BigDecimal volume, int decimals) {
        BigInteger units = TokenAmounts.toBaseUnits(volume, decimals);
        if (units.bitLength() > 62) {
            throw new ScheduleValidationException("Total volume " + volume.toPlainString() + " is too large");
        }
        return units.longValue();
    }

    private static List<String> distinctWallets(List<String> wallets) {
        if (wallets == null) return List.of();
        Set<String> distinct = new LinkedHashSet<>();
        for (String w : wallets) {
            if (w != null && !w.isBlank()) distinct.add(w.trim());
        }
        return new ArrayList<>(distinct);
    }
}
