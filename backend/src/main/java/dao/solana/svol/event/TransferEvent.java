package dao.solana.svol.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Envelope for everything published on the {@link EventBus}.
 * <p>
 * data keeps insertion order so subscribers can render it as-is.
 */
public record TransferEvent(
        EventType type,
        String scheduleId,
        Map<String, Object> data,
        Instant timestamp
) {

    public TransferEvent {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static TransferEvent of(EventType type, String scheduleId, Map<String, Object> data) {
        return new TransferEvent(type, scheduleId, data, Instant.now());
    }

    public Object get(String key) {
        return data.get(key);
    }
}
