package dao.solana.svol.service;

import dao.solana.svol.config.FeeProperties;
import dao.solana.svol.exception.ScheduleValidationException;
import dao.solana.svol.model.Schedule;
import dao.solana.svol.model.ScheduleStatus;
import dao.solana.svol.model.TransferOp;
import dao.solana.svol.util.TokenAmounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Service fee bookkeeping: computes the fee, resizes a schedule to what was actually funded,
 * and appends the transfers that pay the fee to the service wallet.
 */
@Slf4j
@Service
public class FeeCollector {

    static final int MAX_FEE_SENDERS = 5;
    static final Duration FEE_TRANSFER_SPACING = Duration.ofSeconds(30);
    static final Duration EMPTY_SCHEDULE_DELAY = Duration.ofMinutes(5);
    static final Duration FOLLOW_UP_DELAY = Duration.ofSeconds(10);

    private final BigDecimal feeRate;
    private final String serviceWallet;
    private final Clock clock;

    @Autowired
    public FeeCollector(FeeProperties feeProps, Clock clock) {
        this(feeProps.getService().getRate(), feeProps.getService().getWallet(), clock);
    }

    public FeeCollector(BigDecimal feeRate, String serviceWallet, Clock clock) {
        if (feeRate == null || feeRate.signum() < 0 || feeRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("Service fee rate must be in [0, 1), got " + feeRate);
        }
        this.feeRate = feeRate;
        this.serviceWallet = serviceWallet == null || serviceWallet.isBlank() ? null : serviceWallet.trim();
        this.clock = clock;
        log.info("Fee collector initialized: rate={}, serviceWallet={}",
                feeRate.toPlainString(), this.serviceWallet == null ? "<none>" : this.serviceWallet);
    }

    /**
     * True when fee transfers can be generated: a service wallet is set and the rate is non-zero.
     */
    public boolean isEnabled() {
        return serviceWallet != null && feeRate.signum() > 0;
    }

    public BigDecimal getFeeRate() {
        return feeRate;
    }

    public Optional<String> getServiceWallet() {
        return Optional.ofNullable(serviceWallet);
    }

    /**
     * amount * rate at token precision, HALF_UP. A non-zero fee never rounds away to nothing
     * unless the rate itself is below half a minimal unit per token.
     */
    public BigDecimal calculateFee(BigDecimal amount, int decimals) {
        if (amount == null || amount.signum() <= 0 || feeRate.signum() == 0) {
            return BigDecimal.ZERO.setScale(decimals);
        }
        BigDecimal raw = amount.multiply(feeRate);
        BigDecimal fee = raw.setScale(decimals, RoundingMode.HALF_UP);
        if (fee.signum() == 0) {
            boolean rateRoundsToZero = feeRate.movePointRight(decimals).setScale(0, RoundingMode.HALF_UP).signum() == 0;
            return rateRoundsToZero ? fee : TokenAmounts.minimalUnit(decimals).setScale(decimals);
        }
        return fee;
    }

    /**
     * Fit a pending schedule to the amount that actually arrived.
     * Old fee transfers are dropped, regular transfers are scaled to (funded - fee), and new fee
     * transfers for the recomputed fee are appended.
     */
    public Schedule adjustSchedule(Schedule schedule, BigDecimal actualFunded) {
        if (actualFunded == null || actualFunded.signum() <= 0) {
            throw new ScheduleValidationException("Funded amount must be positive, got " + actualFunded);
        }
        if (schedule.getStatus() != ScheduleStatus.PENDING) {
            throw new IllegalStateException("Schedule " + schedule.getId() + " is " + schedule.getStatus()
                    + ", only pending schedules can be adjusted");
        }
        int decimals = schedule.getTokenDecimals();
        BigDecimal funded = actualFunded.setScale(decimals, RoundingMode.DOWN);
        BigDecimal fee = isEnabled() ? calculateFee(funded, decimals) : BigDecimal.ZERO.setScale(decimals);
        BigDecimal distributable = funded.subtract(fee);
        if (distributable.signum() <= 0) {
            throw new ScheduleValidationException("Nothing left to distribute after fee " + fee.toPlainString());
        }
        int regularCount = schedule.regularTransfers().size();
        long distributableUnits = TokenAmounts.toBaseUnits(distributable, decimals).longValueExact();
        if (regularCount > AmountPartitioner.maxDistinctParts(distributableUnits)) {
            throw new ScheduleValidationException("Funded amount " + funded.toPlainString()
                    + " cannot hold " + regularCount + " distinct transfer amounts");
        }

        int dropped = schedule.removeTransfers(TransferOp::isServiceFee);
        List<TransferOp> regular = schedule.regularTransfers();
        if (regular.isEmpty()) {
            schedule.updateTotals(funded, fee);
            if (fee.signum() > 0) addFeeTransfers(schedule, fee);
            return schedule;
        }

        BigDecimal nonFeeVolume = schedule.nonFeeVolume();
        rescale(regular, distributable, nonFeeVolume, decimals);
        schedule.updateTotals(funded, fee);
        if (fee.signum() > 0) addFeeTransfers(schedule, fee);

        log.info("Schedule {} adjusted: funded={}, fee={}, factor={}, transfers={}, droppedFeeTransfers={}",
                schedule.getId(), funded.toPlainString(), fee.toPlainString(),
                distributable.divide(nonFeeVolume, 8, RoundingMode.HALF_UP).toPlainString(),
                regular.size(), dropped);
        return schedule;
    }

    /**
     * Split totalFee over up to five senders, 30 s apart, starting 30 s after the last regular
     * transfer (or five minutes from now on an empty schedule).
     */
    public List<TransferOp> addFeeTransfers(Schedule schedule, BigDecimal totalFee) {
        String wallet = requireServiceWallet();
        int decimals = schedule.getTokenDecimals();
        BigInteger feeUnits = TokenAmounts.toBaseUnits(totalFee, decimals);
        if (feeUnits.signum() <= 0) return List.of();

        List<String> senders = schedule.getChildWallets().stream()
                .filter(w -> !w.equals(wallet))
                .limit(MAX_FEE_SENDERS)
                .toList();
        if (senders.isEmpty()) {
            throw new IllegalStateException("No child wallet can pay the service fee of schedule " + schedule.getId());
        }
        int parts = (int) Math.min(senders.size(), feeUnits.min(BigInteger.valueOf(Integer.MAX_VALUE)).longValue());
        BigInteger[] split = feeUnits.divideAndRemainder(BigInteger.valueOf(parts));

        Instant base = schedule.regularTransfers().stream()
                .map(TransferOp::getScheduledAt)
                .max(Comparator.naturalOrder())
                .map(last -> last.plus(FEE_TRANSFER_SPACING))
                .orElseGet(() -> clock.instant().plus(EMPTY_SCHEDULE_DELAY));

        List<TransferOp> added = new ArrayList<>(parts);
        for (int i = 0; i < parts; i++) {
            BigInteger share = i == 0 ? split[0].add(split[1]) : split[0];
            TransferOp op = new TransferOp(senders.get(i), wallet,
                    TokenAmounts.fromBaseUnits(share, decimals), schedule.getTokenMint(), decimals,
                    base.plus(FEE_TRANSFER_SPACING.multipliedBy(i)), true);
            added.add(op);
        }
        schedule.addTransfers(added);
        log.debug("Added {} fee transfers totalling {} to schedule {}", parts, totalFee.toPlainString(), schedule.getId());
        return added;
    }

    /**
     * Fee transfer that follows a single main transfer 10 s later, paid by the same sender.
     */
    public Optional<TransferOp> generateFeeTransfer(TransferOp mainTransfer) {
        String wallet = requireServiceWallet();
        if (mainTransfer.getFrom().equals(wallet)) return Optional.empty();
        BigDecimal fee = calculateFee(mainTransfer.getAmount(), mainTransfer.getTokenDecimals());
        if (fee.signum() == 0) return Optional.empty();
        return Optional.of(new TransferOp(mainTransfer.getFrom(), wallet, fee, mainTransfer.getTokenMint(),
                mainTransfer.getTokenDecimals(), mainTransfer.getScheduledAt().plus(FOLLOW_UP_DELAY), true));
    }

    // Works in minimal units so the new amounts add up to target exactly and stay pairwise distinct.
    private static void rescale(List<TransferOp> regular, BigDecimal target, BigDecimal currentTotal, int decimals) {
        BigInteger targetUnits = TokenAmounts.toBaseUnits(target, decimals);
        BigInteger currentUnits = TokenAmounts.toBaseUnits(currentTotal, decimals);

        BigInteger[] scaled = new BigInteger[regular.size()];
        BigInteger assigned = BigInteger.ZERO;
        int largest = 0;
        for (int i = 0; i < scaled.length; i++) {
            BigInteger units = TokenAmounts.toBaseUnits(regular.get(i).getAmount(), decimals);
            BigDecimal exact = new BigDecimal(units.multiply(targetUnits)).divide(new BigDecimal(currentUnits), 0, RoundingMode.HALF_UP);
            scaled[i] = exact.toBigInteger().max(BigInteger.ONE);
            assigned = assigned.add(scaled[i]);
            if (scaled[i].compareTo(scaled[largest]) > 0) largest = i;
        }

        BigInteger residue = targetUnits.subtract(assigned);
        while (residue.signum() != 0) {
            BigInteger room = scaled[largest].subtract(BigInteger.ONE);
            BigInteger delta = residue.signum() > 0 ? residue : residue.max(room.negate());
            if (delta.signum() == 0) {
                throw new IllegalStateException("Cannot rescale transfers to " + target.toPlainString());
            }
            scaled[largest] = scaled[largest].add(delta);
            residue = residue.subtract(delta);
            if (residue.signum() != 0) largest = indexOfLargest(scaled);
        }

        // rounding can merge neighbouring amounts
        long[] units = new long[scaled.length];
        for (int i = 0; i < scaled.length; i++) units[i] = scaled[i].longValueExact();
        AmountPartitioner.makeDistinct(units);

        for (int i = 0; i < units.length; i++) {
            regular.get(i).rescale(TokenAmounts.fromBaseUnits(BigInteger.valueOf(units[i]), decimals));
        }
    }

    private static int indexOfLargest(BigInteger[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i].compareTo(values[best]) > 0) best = i;
        }
        return best;
    }

    private String requireServiceWallet() {
        if (serviceWallet == null) {
            throw new IllegalStateException("Service wallet is not configured (fee.service.wallet)");
        }
        return serviceWallet;
    }
}
