package dao.solana.svol.chain;

import java.time.Duration;
import java.util.Optional;

public interface ChainGateway extends FeeSampleSource {

    String recentBlockhash();

    /**
     * @return transaction signature (base58), used as the tx hash everywhere else
     */
    String submit(SignedTransaction transaction);

    ConfirmationResult confirm(String txHash, Duration timeout);

    /**
     * Token account owned by owner for mint, if any.
     */
    Optional<String> findTokenAccount(String owner, String mint);
}
