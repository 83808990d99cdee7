package com.stratum.core.events;

import java.io.Serializable;
import java.util.Map;

/**
 * Observational progress snapshot, published after each flush step.
 *
 * @param phase        "structural" or "semantic"
 * @param batchesDone  units applied so far
 * @param batchesTotal units planned
 * @param currentLine  highest source line covered by the last applied unit
 */
public record ProgressEvent(String phase, int batchesDone, int batchesTotal, int currentLine) implements Serializable {

    public static final String STRUCTURAL = "structural";
    public static final String SEMANTIC = "semantic";

    public Map<String, Object> toPayload() {
        return Map.of(
                "phase", phase,
                "batchesDone", batchesDone,
                "batchesTotal", batchesTotal,
                "currentLine", currentLine);
    }

    public static ProgressEvent fromPayload(Map<String, Object> payload) {
        return new ProgressEvent(
                (String) payload.get("phase"),
                ((Number) payload.get("batchesDone")).intValue(),
                ((Number) payload.get("batchesTotal")).intValue(),
                ((Number) payload.get("currentLine")).intValue());
    }
}
