package dao.solana.svol.chain;

import dao.solana.svol.model.TransferOp;
import dao.solana.svol.wallet.SigningSecret;

public interface TransactionFactory {

    /**
     * Build and sign the transfer. Native and token transfers share this single path,
     * keyed by the transfer's mint.
     */
    SignedTransaction build(TransferOp transfer, SigningSecret signer, long feeUnits, String recentBlockhash);
}
