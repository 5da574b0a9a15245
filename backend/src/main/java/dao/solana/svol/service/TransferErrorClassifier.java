package dao.solana.svol.service;

import java.util.List;
import java.util.Locale;

/**
 * Recognizes chain errors that a higher fee cannot fix.
 */
public final class TransferErrorClassifier {
    private TransferErrorClassifier() {}

    private static final List<String> INSUFFICIENT_FUNDS_MARKERS = List.of(
            "insufficientfunds",
            "insufficient funds",
            "insufficient lamports",
            "no record of a prior credit"
    );

    public static boolean isInsufficientFunds(String error) {
        if (error == null) return false;
        String normalized = error.toLowerCase(Locale.ROOT);
        return INSUFFICIENT_FUNDS_MARKERS.stream().anyMatch(normalized::contains);
    }

    public static boolean isInsufficientFunds(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (isInsufficientFunds(t.getMessage())) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }
}
