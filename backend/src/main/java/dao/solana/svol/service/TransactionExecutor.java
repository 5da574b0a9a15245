package dao.solana.svol.service;

import dao.solana.svol.chain.ChainGateway;
import dao.solana.svol.chain.ConfirmationResult;
import dao.solana.svol.chain.SignedTransaction;
import dao.solana.svol.chain.TransactionFactory;
import dao.solana.svol.config.SchedulerProperties;
import dao.solana.svol.event.EventBus;
import dao.solana.svol.event.EventType;
import dao.solana.svol.event.TransferEvent;
import dao.solana.svol.exception.ChainRpcException;
import dao.solana.svol.exception.GasSpikeException;
import dao.solana.svol.exception.InsufficientFundsException;
import dao.solana.svol.exception.TransactionTimeoutException;
import dao.solana.svol.model.ApprovalContext;
import dao.solana.svol.model.FeeEstimate;
import dao.solana.svol.model.TransferOp;
import dao.solana.svol.model.TransferResult;
import dao.solana.svol.wallet.SigningSecret;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends one transfer: fee spike gate first, then submit and confirm with bounded,
 * fee-escalating retries.
 * <p>
 * Failures of the transfer itself come back as a {@link TransferResult}; only a fee spike
 * without an approval path is thrown.
 */
@Slf4j
public class TransactionExecutor {

    private final ChainGateway chain;
    private final TransactionFactory transactionFactory;
    private final FeeOracle feeOracle;
    private final EventBus eventBus;
    private final ApprovalCallback approvalCallback;
    private final SchedulerProperties.ExecutionConfig config;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    /**
     * @param approvalCallback may be null; spikes then fail with {@link GasSpikeException}
     */
    public TransactionExecutor(ChainGateway chain,
                               TransactionFactory transactionFactory,
                               FeeOracle feeOracle,
                               EventBus eventBus,
                               ApprovalCallback approvalCallback,
                               SchedulerProperties.ExecutionConfig config,
                               Clock clock) {
        this.chain = chain;
        this.transactionFactory = transactionFactory;
        this.feeOracle = feeOracle;
        this.eventBus = eventBus;
        this.approvalCallback = approvalCallback;
        this.config = config;
        this.retryPolicy = RetryPolicy.from(config);
        this.clock = clock;
    }

    public TransferResult execute(TransferOp transfer, SigningSecret signer) {
        FeeEstimate estimate = feeOracle.currentEstimate();
        long fee = Math.max(estimate.feeUnits(), feeOracle.recommendedFee());

        if (config.isSpikeCheckEnabled() && estimate.spike()) {
            if (approvalCallback == null || !config.isRequireApprovalOnSpike()) {
                throw new GasSpikeException(estimate.feeUnits(), feeOracle.spikeLimit(), feeOracle.averageFee());
            }
            if (!awaitApproval(transfer, estimate)) {
                log.warn("Transfer {} -> {} aborted: fee spike not approved (fee={})",
                        transfer.getFrom(), transfer.getTo(), estimate.feeUnits());
                return TransferResult.aborted("Fee spike not approved (fee=" + estimate.feeUnits() + ")");
            }
            log.info("Fee spike approved for {} -> {}, sending at fee={}", transfer.getFrom(), transfer.getTo(), fee);
        }

        if (config.isDryRun()) {
            return dryRun(transfer, fee);
        }

        Duration timeout = Duration.ofSeconds(config.getConfirmationTimeoutSeconds());
        int maxRetries = retryPolicy.getMaxRetries();
        String lastError = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                fee = feeOracle.feeForRetry(fee, attempt);
                publish(EventType.TRANSACTION_RETRY, transfer, Map.of(
                        "attempt", attempt,
                        "fee", fee,
                        "error", String.valueOf(lastError)));
                long delay = retryPolicy.delayMs(attempt);
                log.warn("Retrying transfer {} -> {} (retry {}/{}) in {}ms with fee={}",
                        transfer.getFrom(), transfer.getTo(), attempt, maxRetries, delay, fee);
                if (!sleep(delay)) {
                    return fail(transfer, "Interrupted while waiting to retry", attempt - 1);
                }
            }

            long startedAt = clock.millis();
            try {
                String blockhash = chain.recentBlockhash();
                SignedTransaction tx = transactionFactory.build(transfer, signer, fee, blockhash);
                String txHash = chain.submit(tx);
                publish(EventType.TRANSACTION_SENT, transfer, Map.of(
                        "txHash", txHash,
                        "fee", fee,
                        "attempt", attempt));

                ConfirmationResult confirmation = chain.confirm(txHash, timeout);
                if (confirmation.confirmed()) {
                    long elapsed = clock.millis() - startedAt;
                    publish(EventType.TRANSACTION_CONFIRMED, transfer, Map.of(
                            "txHash", txHash,
                            "fee", fee,
                            "retryCount", attempt,
                            "confirmationMs", elapsed));
                    log.info("Transfer confirmed: {} -> {}, amount={}, txHash={}, fee={}, retries={}",
                            transfer.getFrom(), transfer.getTo(), transfer.getAmount().toPlainString(), txHash, fee, attempt);
                    return TransferResult.confirmed(txHash, fee, attempt, elapsed);
                }
                if (confirmation.isTimeout()) {
                    throw new TransactionTimeoutException(txHash, timeout);
                }
                throw new ChainRpcException("Transaction " + txHash + " failed: " + confirmation.error());
            } catch (IllegalArgumentException e) {
                // malformed transfer or wrong key: a new attempt would build the same thing
                return fail(transfer, e.getMessage(), attempt);
            } catch (RuntimeException e) {
                RuntimeException classified = classify(e);
                lastError = classified.getMessage();
                if (classified instanceof InsufficientFundsException) {
                    log.error("Transfer {} -> {} cannot be paid for, giving up: {}",
                            transfer.getFrom(), transfer.getTo(), lastError);
                    return fail(transfer, lastError, attempt);
                }
                log.warn("Attempt {} for {} -> {} failed: {}", attempt + 1, transfer.getFrom(), transfer.getTo(), lastError);
            }
        }

        log.error("Transfer {} -> {} failed after {} retries: {}", transfer.getFrom(), transfer.getTo(), maxRetries, lastError);
        return fail(transfer, lastError, maxRetries);
    }

    static RuntimeException classify(RuntimeException e) {
        if (e instanceof InsufficientFundsException) return e;
        if (TransferErrorClassifier.isInsufficientFunds(e)) {
            return new InsufficientFundsException("Insufficient funds: " + e.getMessage(), e);
        }
        return e;
    }

    private boolean awaitApproval(TransferOp transfer, FeeEstimate estimate) {
        BigDecimal average = feeOracle.averageFee();
        BigDecimal multiplier = average.signum() == 0
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(estimate.feeUnits()).divide(average, 2, RoundingMode.HALF_UP);
        ApprovalContext context = new ApprovalContext(transfer.getScheduleId(), transfer.getFrom(), transfer.getTo(),
                transfer.getAmount(), transfer.getTokenMint(), estimate.feeUnits(), average, multiplier);

        CompletableFuture<Boolean> decision;
        try {
            decision = approvalCallback.requestApproval(context).toCompletableFuture();
        } catch (RuntimeException e) {
            log.error("Approval request failed for schedule {}: {}", transfer.getScheduleId(), e.getMessage(), e);
            return false;
        }
        try {
            return Boolean.TRUE.equals(decision.get(config.getApprovalTimeoutSeconds(), TimeUnit.SECONDS));
        } catch (TimeoutException e) {
            decision.complete(false);
            log.warn("Approval for schedule {} timed out after {}s", transfer.getScheduleId(), config.getApprovalTimeoutSeconds());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            decision.complete(false);
            return false;
        } catch (ExecutionException e) {
            log.warn("Approval for schedule {} failed: {}", transfer.getScheduleId(), e.getCause().getMessage());
            return false;
        }
    }

    private TransferResult dryRun(TransferOp transfer, long fee) {
        String txHash = "dryrun-" + UUID.randomUUID();
        publish(EventType.TRANSACTION_SENT, transfer, Map.of("txHash", txHash, "fee", fee, "attempt", 0));
        publish(EventType.TRANSACTION_CONFIRMED, transfer, Map.of("txHash", txHash, "fee", fee, "retryCount", 0, "confirmationMs", 0L));
        log.info("[dry-run] {} -> {}, amount={}, fee={}", transfer.getFrom(), transfer.getTo(),
                transfer.getAmount().toPlainString(), fee);
        return TransferResult.confirmed(txHash, fee, 0, 0L);
    }

    private TransferResult fail(TransferOp transfer, String reason, int retryCount) {
        publish(EventType.TRANSACTION_FAILED, transfer, Map.of(
                "error", String.valueOf(reason),
                "retryCount", retryCount));
        return TransferResult.failed(reason, retryCount);
    }

    private void publish(EventType type, TransferOp transfer, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("from", transfer.getFrom());
        data.put("to", transfer.getTo());
        data.put("amount", transfer.getAmount());
        data.put("token", transfer.getTokenMint());
        data.putAll(extra);
        eventBus.publish(TransferEvent.of(type, transfer.getScheduleId(), data));
    }

    private static boolean sleep(long ms) {
        if (ms <= 0) return !Thread.currentThread().isInterrupted();
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
