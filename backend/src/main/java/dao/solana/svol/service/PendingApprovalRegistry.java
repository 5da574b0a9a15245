package dao.solana.svol.service;

import dao.solana.svol.event.EventBus;
import dao.solana.svol.event.EventType;
import dao.solana.svol.event.TransferEvent;
import dao.solana.svol.model.ApprovalContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default approval path: parks each request under an id, announces it on the event bus and
 * waits for someone to call {@link #resolve(String, boolean)} (the REST endpoint does).
 */
@Slf4j
@Component
public class PendingApprovalRegistry implements ApprovalCallback {

    private final EventBus eventBus;
    private final Clock clock;
    private final Map<String, PendingApproval> pending = new ConcurrentHashMap<>();

    public PendingApprovalRegistry(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public CompletionStage<Boolean> requestApproval(ApprovalContext context) {
        String approvalId = UUID.randomUUID().toString();
        CompletableFuture<Boolean> decision = new CompletableFuture<>();
        pending.put(approvalId, new PendingApproval(approvalId, context, clock.instant(), decision));
        decision.whenComplete((approved, error) -> pending.remove(approvalId));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("approvalId", approvalId);
        data.put("from", context.from());
        data.put("to", context.to());
        data.put("amount", context.amount());
        data.put("token", context.token());
        data.put("estimatedFee", context.estimatedFee());
        data.put("averageFee", context.averageFee());
        data.put("spikeMultiplier", context.spikeMultiplier());
        eventBus.publish(TransferEvent.of(EventType.APPROVAL_REQUESTED, context.scheduleId(), data));

        log.info("Approval {} requested for schedule {}: fee={} ({}x average)",
                approvalId, context.scheduleId(), context.estimatedFee(), context.spikeMultiplier());
        return decision;
    }

    /**
     * @return false when no such approval is waiting (unknown, already decided or timed out)
     */
    public boolean resolve(String approvalId, boolean approved) {
        PendingApproval p = pending.get(approvalId);
        if (p == null) return false;
        boolean completed = p.decision().complete(approved);
        if (completed) {
            log.info("Approval {} {}", approvalId, approved ? "granted" : "rejected");
        }
        return completed;
    }

    public List<PendingApproval> pending() {
        List<PendingApproval> out = new ArrayList<>(pending.values());
        out.sort(Comparator.comparing(PendingApproval::requestedAt));
        return out;
    }

    public List<PendingApproval> pendingFor(String scheduleId) {
        return pending().stream().filter(p -> scheduleId.equals(p.context().scheduleId())).toList();
    }

    public record PendingApproval(
            String approvalId,
            ApprovalContext context,
            Instant requestedAt,
            CompletableFuture<Boolean> decision
    ) {}
}
