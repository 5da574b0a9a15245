package dao.solana.svol.chain;

import dao.solana.svol.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Base58;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * In-process chain: accepts every signed transaction and confirms it immediately.
 * Fee samples wander +/-10% around a base value. Token accounts are the owner address itself.
 */
@Slf4j
public class SimulatedChainGateway implements ChainGateway {

    private final long baseFee;
    private final Map<String, SignedTransaction> submitted = new ConcurrentHashMap<>();

    public SimulatedChainGateway(long baseFee) {
        if (baseFee < 0) throw new IllegalArgumentException("baseFee must be >= 0");
        this.baseFee = baseFee;
        log.info("Simulated chain gateway initialized: baseFee={}", baseFee);
    }

    @Override
    public String recentBlockhash() {
        return Base58.encode(CryptoUtil.randomBytes32());
    }

    @Override
    public String submit(SignedTransaction transaction) {
        submitted.put(transaction.signature(), transaction);
        log.debug("Simulated submit {} ({} -> {}, fee={})",
                transaction.signature(), transaction.from(), transaction.to(), transaction.feeUnits());
        return transaction.signature();
    }

    @Override
    public ConfirmationResult confirm(String txHash, Duration timeout) {
        return submitted.containsKey(txHash)
                ? ConfirmationResult.ok()
                : ConfirmationResult.failed("unknown transaction " + txHash);
    }

    @Override
    public long latestFeeSample() {
        long spread = baseFee / 10;
        if (spread == 0) return baseFee;
        return baseFee + ThreadLocalRandom.current().nextLong(-spread, spread + 1);
    }

    @Override
    public Optional<String> findTokenAccount(String owner, String mint) {
        return Optional.of(owner);
    }

    public int submittedCount() {
        return submitted.size();
    }
}
