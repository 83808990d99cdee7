package com.stratum.core.port;

import java.util.Map;

/**
 * Side-effect target for analysis results. Every call is an idempotent upsert keyed by
 * stable identity, so replays and incremental re-runs are safe.
 */
public interface GraphSink {

    /** Structural node from the collection phase. */
    void upsertNode(String nodeKey, String kind, LineRange span, Map<String, Object> properties);

    void upsertNodeSummary(String nodeKey, String kind, LineRange span, String summary,
                           Map<String, Object> extraProperties);

    /** Creates the target when it does not exist yet. */
    void upsertEdge(String fromKey, String toKey, String edgeType, Map<String, Object> properties);

    void upsertContainerSummary(String containerKey, String summary);
}
