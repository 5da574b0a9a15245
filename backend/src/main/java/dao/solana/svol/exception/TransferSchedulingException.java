package dao.solana.svol.exception;

/**
 * Root of the errors raised while generating or executing transfer schedules.
 */
public class TransferSchedulingException extends RuntimeException {

    public TransferSchedulingException(String message) {
        super(message);
    }

    public TransferSchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
