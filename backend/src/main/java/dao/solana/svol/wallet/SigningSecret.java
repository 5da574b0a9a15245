package dao.solana.svol.wallet;

import dao.solana.svol.util.CryptoUtil;
import org.bitcoinj.core.Base58;
import org.p2p.solanaj.core.Account;

import java.util.Arrays;

/**
 * Decrypted secret key scoped to one transfer execution. close() zeroes the bytes;
 * any use afterwards fails.
 */
public final class SigningSecret implements AutoCloseable {

    private final byte[] secretKey;
    private final String address;
    private volatile boolean closed;

    /**
     * Takes ownership of secretKey; the array is wiped on close.
     */
    public SigningSecret(byte[] secretKey) {
        if (secretKey == null || secretKey.length != CryptoUtil.SECRET_KEY_LENGTH) {
            throw new IllegalArgumentException("Secret key must be " + CryptoUtil.SECRET_KEY_LENGTH + " bytes");
        }
        this.secretKey = secretKey;
        this.address = Base58.encode(CryptoUtil.publicKeyOf(secretKey));
    }

    public String address() {
        return address;
    }

    public byte[] publicKey() {
        ensureOpen();
        return CryptoUtil.publicKeyOf(secretKey);
    }

    /**
     * Signing account for one transaction build. The account holds its own copy of the key,
     * so callers drop it as soon as the transaction is signed.
     */
    public Account toAccount() {
        ensureOpen();
        return new Account(secretKey.clone());
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        Arrays.fill(secretKey, (byte) 0);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Signing secret for " + address + " already released");
        }
    }

    @Override
    public String toString() {
        return "SigningSecret[" + address + "]";
    }
}
