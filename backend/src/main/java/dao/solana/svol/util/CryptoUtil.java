package dao.solana.svol.util;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Cryptographic utilities.
 *
 * IMPORTANT:
 * - Solana secret keys are 64 bytes: 32-byte Ed25519 seed followed by the 32-byte public key.
 * - Callers own (and wipe) the secret bytes; signing happens in the chain layer.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    public static final int SECRET_KEY_LENGTH = 64;
    public static final int SEED_LENGTH = 32;

    private static final SecureRandom RNG = new SecureRandom();

    public static byte[] randomBytes32() {
        byte[] bytes = new byte[32];
        RNG.nextBytes(bytes);
        return bytes;
    }

    /**
     * Public key half of a 64-byte Solana secret key.
     */
    public static byte[] publicKeyOf(byte[] secretKey) {
        requireSecretKey(secretKey);
        return Arrays.copyOfRange(secretKey, SEED_LENGTH, SECRET_KEY_LENGTH);
    }

    private static void requireSecretKey(byte[] secretKey) {
        if (secretKey == null || secretKey.length != SECRET_KEY_LENGTH) {
            throw new IllegalArgumentException("Secret key must be " + SECRET_KEY_LENGTH + " bytes");
        }
    }
}
