package com.stratum.core.port;

import java.io.Serializable;
import java.util.Map;

/**
 * A reference from an analyzed statement to another entity (table, procedure, type, variable).
 *
 * @param target     name of the referenced entity
 * @param edgeType   relationship label, e.g. "READS", "WRITES", "CALLS"
 * @param properties extra relationship properties
 */
public record CrossReference(String target, String edgeType, Map<String, Object> properties) implements Serializable {

    public CrossReference {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
