package dao.solana.svol.wallet;

import dao.solana.svol.config.WalletProperties;
import dao.solana.svol.exception.WalletKeyNotFoundException;
import dao.solana.svol.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Base58;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class InMemoryWalletKeyProvider implements WalletKeyProvider {

    // key: base58 address
    private final Map<String, byte[]> secretsByAddress = new ConcurrentHashMap<>();

    public InMemoryWalletKeyProvider() {
    }

    @Autowired
    public InMemoryWalletKeyProvider(WalletProperties props) {
        for (String encoded : props.getSecretKeys()) {
            if (encoded == null || encoded.isBlank()) continue;
            register(encoded.trim());
        }
        if (!secretsByAddress.isEmpty()) {
            log.info("Loaded {} wallet keys from configuration", secretsByAddress.size());
        }
    }

    /**
     * Register a base58 encoded 64-byte secret key.
     *
     * @return the wallet address derived from the key
     */
    public String register(String base58SecretKey) {
        return register(Base58.decode(base58SecretKey));
    }

    public String register(byte[] secretKey) {
        if (secretKey.length != CryptoUtil.SECRET_KEY_LENGTH) {
            throw new IllegalArgumentException("Secret key must be " + CryptoUtil.SECRET_KEY_LENGTH
                    + " bytes, got " + secretKey.length);
        }
        String address = Base58.encode(CryptoUtil.publicKeyOf(secretKey));
        secretsByAddress.put(address, secretKey.clone());
        return address;
    }

    @Override
    public SigningSecret resolve(String address) {
        byte[] stored = secretsByAddress.get(address);
        if (stored == null) {
            throw new WalletKeyNotFoundException(address);
        }
        return new SigningSecret(stored.clone());
    }

    @Override
    public boolean contains(String address) {
        return secretsByAddress.containsKey(address);
    }

    public int size() {
        return secretsByAddress.size();
    }
}
