package dao.solana.svol.chain;

import java.util.Base64;

/**
 * Wire-ready transaction. signature is the base58 first signature, which is also the tx id.
 */
public record SignedTransaction(
        String signature,
        byte[] wireBytes,
        String from,
        String to,
        long feeUnits
) {

    public String base64() {
        return Base64.getEncoder().encodeToString(wireBytes);
    }
}
