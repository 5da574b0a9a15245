package dao.solana.svol.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class TransactionTimeoutException extends TransferSchedulingException {

    private final String txHash;

    public TransactionTimeoutException(String txHash, Duration timeout) {
        super("Transaction " + txHash + " not confirmed within " + timeout.toSeconds() + "s");
        this.txHash = txHash;
    }
}
