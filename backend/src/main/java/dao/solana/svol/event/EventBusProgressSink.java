package dao.solana.svol.event;

import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class EventBusProgressSink implements ProgressSink {

    private final EventBus eventBus;

    public EventBusProgressSink(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void onProgress(String scheduleId, Map<String, Object> progress) {
        eventBus.publish(TransferEvent.of(EventType.SCHEDULE_PROGRESS, scheduleId, progress));
    }
}
