package com.stratum.core.port;

import java.io.Serializable;
import java.util.List;

/**
 * The annotator's result for one input range.
 *
 * @param startLine first line of the range this result answers
 * @param endLine   last line of the range
 * @param summary   summary text (blank means the node was skipped)
 * @param crossRefs references found in the statement
 */
public record NodeAnnotation(
    int startLine,
    int endLine,
    String summary,
    List<CrossReference> crossRefs
) implements Serializable {

    public NodeAnnotation {
        crossRefs = crossRefs == null ? List.of() : List.copyOf(crossRefs);
    }

    public LineRange range() {
        return new LineRange(startLine, endLine);
    }

    public boolean hasSummary() {
        return summary != null && !summary.isBlank();
    }
}
