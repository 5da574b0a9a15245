package dao.solana.svol.exception;

/**
 * Bad input to schedule generation. Never retried.
 */
public class ScheduleValidationException extends TransferSchedulingException {

    public ScheduleValidationException(String message) {
        super(message);
    }
}
