package dao.solana.svol.exception;

/**
 * Sender cannot pay fee or rent. Raising the fee cannot fix this, so retries stop here.
 */
public class InsufficientFundsException extends TransferSchedulingException {

    public InsufficientFundsException(String message) {
        super(message);
    }

    public InsufficientFundsException(String message, Throwable cause) {
        super(message, cause);
    }
}
