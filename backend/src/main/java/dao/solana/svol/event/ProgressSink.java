package dao.solana.svol.event;

import java.util.Map;

/**
 * Receives schedule progress. Every map carries at least "status" and "timestamp".
 */
@FunctionalInterface
public interface ProgressSink {

    void onProgress(String scheduleId, Map<String, Object> progress);
}
