package com.stratum.core.apply;

import com.stratum.core.tree.ContainerInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A container whose analyzable descendants are all applied (or whose run is finishing),
 * together with a snapshot of the summaries recorded under it.
 *
 * @param fileId    the file the container belongs to
 * @param container the container
 * @param fragments {@code "<kind>_<start>_<end>"} to summary, in apply order
 * @param complete  false when the container is finalized with descendants still pending
 */
public record ContainerReadyEvent(String fileId, ContainerInfo container, Map<String, String> fragments,
                                  boolean complete) {

    public ContainerReadyEvent {
        fragments = Collections.unmodifiableMap(new LinkedHashMap<>(fragments));
    }
}
