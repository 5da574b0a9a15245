package dao.solana.svol.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Current fee is above the spike threshold and there is no approval path to override it.
 */
@Getter
public class GasSpikeException extends TransferSchedulingException {

    private final long currentFee;
    private final BigDecimal threshold;
    private final BigDecimal averageFee;

    public GasSpikeException(long currentFee, BigDecimal threshold, BigDecimal averageFee) {
        super("Fee spike: current=" + currentFee + ", average=" + averageFee.toPlainString()
                + ", threshold=" + threshold.toPlainString());
        this.currentFee = currentFee;
        this.threshold = threshold;
        this.averageFee = averageFee;
    }
}
