package dao.solana.svol.chain;

/**
 * confirmed=false with error=null means the wait timed out.
 */
public record ConfirmationResult(
        boolean confirmed,
        String error
) {

    public static ConfirmationResult ok() {
        return new ConfirmationResult(true, null);
    }

    public static ConfirmationResult failed(String error) {
        return new ConfirmationResult(false, error);
    }

    public static ConfirmationResult timedOut() {
        return new ConfirmationResult(false, null);
    }

    public boolean isTimeout() {
        return !confirmed && error == null;
    }
}
