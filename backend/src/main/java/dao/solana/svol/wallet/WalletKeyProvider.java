package dao.solana.svol.wallet;

import dao.solana.svol.exception.WalletKeyNotFoundException;

/**
 * Hands out signing capability for an address. Implementations are expected to be thread-safe.
 * <p>
 * Every call returns a fresh {@link SigningSecret}; the caller closes it as soon as the transfer
 * is signed, on success and failure alike.
 */
public interface WalletKeyProvider {

    SigningSecret resolve(String address) throws WalletKeyNotFoundException;

    boolean contains(String address);
}
