package dao.solana.svol.service;

import dao.solana.svol.event.ProgressSink;
import dao.solana.svol.event.ProgressStatus;
import dao.solana.svol.exception.GasSpikeException;
import dao.solana.svol.exception.WalletKeyNotFoundException;
import dao.solana.svol.model.Schedule;
import dao.solana.svol.model.ScheduleRunResult;
import dao.solana.svol.model.ScheduleStatus;
import dao.solana.svol.model.TransferOp;
import dao.solana.svol.model.TransferResult;
import dao.solana.svol.model.TransferStatus;
import dao.solana.svol.wallet.SigningSecret;
import dao.solana.svol.wallet.WalletKeyProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the transfers of one schedule in time order on the calling thread.
 * <p>
 * A failed transfer never stops the run; only a stop request does. Keys are resolved per
 * transfer and released right after it, whatever the outcome.
 */
@Slf4j
public class ScheduleExecutor {

    private final TransactionExecutor transactionExecutor;
    private final WalletKeyProvider keyProvider;
    private final ProgressSink progressSink;
    private final Clock clock;

    public ScheduleExecutor(TransactionExecutor transactionExecutor, WalletKeyProvider keyProvider,
                            ProgressSink progressSink, Clock clock) {
        this.transactionExecutor = transactionExecutor;
        this.keyProvider = keyProvider;
        this.progressSink = progressSink;
        this.clock = clock;
    }

    public ScheduleRunResult run(Schedule schedule, ScheduleRun run) {
        long startedMs = clock.millis();
        List<TransferOp> ordered;
        synchronized (schedule) {
            schedule.markInProgress();
            ordered = new ArrayList<>(schedule.getTransfers());
        }
        ordered.sort(Comparator.comparing(TransferOp::getScheduledAt));
        int total = ordered.size();

        log.info("Schedule {} started: {} transfers", schedule.getId(), total);
        progress(schedule, ProgressStatus.STARTED, Map.of("totalTransfers", total));

        boolean stopped = false;
        for (int i = 0; i < total; i++) {
            TransferOp transfer = ordered.get(i);
            int index = i + 1;
            if (!transfer.isPending()) continue;

            if (run.isStopRequested()) {
                stopped = true;
                break;
            }

            Duration wait = Duration.between(clock.instant(), transfer.getScheduledAt());
            if (!wait.isNegative() && !wait.isZero()) {
                progress(schedule, ProgressStatus.WAITING, Map.of(
                        "index", index,
                        "totalTransfers", total,
                        "scheduledAt", transfer.getScheduledAt().toString(),
                        "waitSeconds", wait.toSeconds()));
                try {
                    if (run.awaitStop(wait)) {
                        stopped = true;
                        break;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    run.requestStop();
                    stopped = true;
                    break;
                }
            }

            if (run.isStopRequested()) {
                stopped = true;
                break;
            }

            progress(schedule, ProgressStatus.EXECUTING, Map.of(
                    "index", index,
                    "totalTransfers", total,
                    "from", transfer.getFrom(),
                    "to", transfer.getTo(),
                    "amount", transfer.getAmount().toPlainString()));
            executeOne(schedule, transfer, index, total);
        }

        if (stopped) {
            log.info("Schedule {} stopped on request", schedule.getId());
            progress(schedule, ProgressStatus.STOPPED, Map.of(
                    "completed", (int) schedule.countByStatus(TransferStatus.COMPLETED),
                    "remaining", (int) schedule.countByStatus(TransferStatus.PENDING)));
        }

        ScheduleStatus status = schedule.finish(clock.instant());
        int successful = (int) schedule.countByStatus(TransferStatus.COMPLETED);
        int failed = (int) schedule.countByStatus(TransferStatus.FAILED);
        int notExecuted = (int) schedule.countByStatus(TransferStatus.PENDING);
        long elapsed = clock.millis() - startedMs;

        if (!stopped) {
            progress(schedule, ProgressStatus.COMPLETED, Map.of(
                    "successful", successful,
                    "failed", failed,
                    "finalStatus", status.name(),
                    "elapsedMs", elapsed));
        }
        log.info("Schedule {} finished: status={}, successful={}, failed={}, notExecuted={}, elapsedMs={}",
                schedule.getId(), status, successful, failed, notExecuted, elapsed);
        return new ScheduleRunResult(schedule.getId(), status, successful, failed, notExecuted, stopped, elapsed);
    }

    private void executeOne(Schedule schedule, TransferOp transfer, int index, int total) {
        transfer.markInProgress();
        TransferResult result;
        try (SigningSecret secret = keyProvider.resolve(transfer.getFrom())) {
            result = transactionExecutor.execute(transfer, secret);
        } catch (WalletKeyNotFoundException e) {
            log.error("No keypair for {} in schedule {}", transfer.getFrom(), schedule.getId());
            result = TransferResult.failed("no keypair for " + transfer.getFrom(), 0);
        } catch (GasSpikeException e) {
            log.warn("Transfer {}/{} of schedule {} blocked: {}", index, total, schedule.getId(), e.getMessage());
            result = TransferResult.failed(e.getMessage(), 0);
        } catch (RuntimeException e) {
            log.error("Transfer {}/{} of schedule {} failed unexpectedly", index, total, schedule.getId(), e);
            result = TransferResult.failed("Unexpected error: " + e.getMessage(), 0);
        }

        Instant now = clock.instant();
        transfer.recordAttempt(result.feeUsed(), result.retryCount());
        if (result.isConfirmed()) {
            transfer.markCompleted(result.txHash(), now);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("index", index);
            data.put("totalTransfers", total);
            data.put("txHash", result.txHash());
            data.put("fee", result.feeUsed());
            data.put("retryCount", result.retryCount());
            progress(schedule, ProgressStatus.INSTRUCTION_COMPLETE, data);
        } else {
            transfer.markFailed(result.reason(), now);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("index", index);
            data.put("totalTransfers", total);
            data.put("outcome", result.outcome().name());
            data.put("error", result.reason());
            progress(schedule, ProgressStatus.INSTRUCTION_FAILED, data);
        }
    }

    private void progress(Schedule schedule, ProgressStatus status, Map<String, Object> fields) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status.name());
        data.put("timestamp", clock.instant().toString());
        data.putAll(fields);
        try {
            progressSink.onProgress(schedule.getId(), data);
        } catch (RuntimeException e) {
            log.warn("Progress sink failed for schedule {}: {}", schedule.getId(), e.getMessage());
        }
    }
}
