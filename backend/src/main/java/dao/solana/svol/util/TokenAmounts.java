package dao.solana.svol.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

public final class TokenAmounts {
    private TokenAmounts() {}

    public static final int NATIVE_DECIMALS = 9;

    /** 1.5 with 6 decimals -> 1500000 */
    public static BigInteger toBaseUnits(BigDecimal amount, int decimals) {
        return amount.movePointRight(decimals).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    public static BigDecimal fromBaseUnits(BigInteger units, int decimals) {
        return new BigDecimal(units, decimals);
    }

    public static BigDecimal fromBaseUnits(long units, int decimals) {
        return BigDecimal.valueOf(units, decimals);
    }

    /** The smallest representable amount at the given precision, e.g. 0.000001 for 6 decimals. */
    public static BigDecimal minimalUnit(int decimals) {
        return BigDecimal.ONE.movePointLeft(decimals);
    }

    public static BigDecimal atScale(BigDecimal amount, int decimals) {
        return amount.setScale(decimals, RoundingMode.HALF_UP);
    }
}
