package dao.solana.svol.event;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Subscriber that logs bus traffic and remembers the latest progress of every schedule,
 * so the monitoring endpoints can answer without touching the running worker.
 */
@Slf4j
@Component
public class ScheduleProgressTracker {

    private final EventBus eventBus;
    private final Map<String, TransferEvent> lastProgress = new ConcurrentHashMap<>();
    private final List<Subscription> subscriptions = new ArrayList<>();

    public ScheduleProgressTracker(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    public void register() {
        subscriptions.add(eventBus.subscribe(EventType.SCHEDULE_PROGRESS, this::onProgress));
        subscriptions.add(eventBus.subscribe(EventType.TRANSACTION_FAILED, e ->
                log.warn("Transfer failed: schedule={}, from={}, to={}, error={}",
                        e.scheduleId(), e.get("from"), e.get("to"), e.get("error"))));
        subscriptions.add(eventBus.subscribe(EventType.TRANSACTION_CONFIRMED, e ->
                log.info("Transfer confirmed: schedule={}, txHash={}", e.scheduleId(), e.get("txHash"))));
        subscriptions.add(eventBus.subscribe(EventType.APPROVAL_REQUESTED, e ->
                log.warn("Approval requested: schedule={}, approvalId={}, fee={}",
                        e.scheduleId(), e.get("approvalId"), e.get("estimatedFee"))));
    }

    @PreDestroy
    public void unregister() {
        subscriptions.forEach(Subscription::close);
        subscriptions.clear();
    }

    void onProgress(TransferEvent event) {
        if (event.scheduleId() == null) return;
        lastProgress.put(event.scheduleId(), event);
        log.debug("Schedule {} progress: {}", event.scheduleId(), event.data());
    }

    public Optional<TransferEvent> lastProgress(String scheduleId) {
        return Optional.ofNullable(lastProgress.get(scheduleId));
    }
}
