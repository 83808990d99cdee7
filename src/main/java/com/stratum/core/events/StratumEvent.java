package com.stratum.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a file moves through the pipeline, consumed by the CLI.
 *
 * @param eventType event type (e.g. "file.started", "analysis.progress", "container.summarized")
 * @param fileId    the file this event belongs to
 * @param batchId   the batch this event relates to (nullable for file-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record StratumEvent(
    String eventType,
    String fileId,
    Integer batchId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static StratumEvent of(String eventType, String fileId, Map<String, Object> payload) {
        return new StratumEvent(eventType, fileId, null, payload, Instant.now());
    }
}
