package dao.solana.svol.exception;

/**
 * Transport or node-side error talking to the chain.
 */
public class ChainRpcException extends TransferSchedulingException {

    public ChainRpcException(String message) {
        super(message);
    }

    public ChainRpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
