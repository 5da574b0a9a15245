package dao.solana.svol.exception;

public class WalletKeyNotFoundException extends TransferSchedulingException {

    public WalletKeyNotFoundException(String address) {
        super("No keypair registered for " + address);
    }
}
