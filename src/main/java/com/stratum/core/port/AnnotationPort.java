package com.stratum.core.port;

import java.util.List;
import java.util.Map;

/**
 * The external semantic-analysis service. Calls are synchronous and stateless; the
 * scheduler supplies concurrency, deadlines and cancellation.
 * <p>
 * Implementations signal transport problems by throwing; an answer that simply omits
 * some ranges is returned normally.
 */
public interface AnnotationPort {

    /**
     * @param payload rendered code of every batch member
     * @param ranges  one range per member, in member order
     * @param context contexts of the members' enclosing parents, empty when there are none
     * @param locale  language for the produced summaries
     */
    BatchAnnotation analyzeBatch(String payload, List<LineRange> ranges, String context, String locale);

    /**
     * @param namedFragments fragment label to summary text, in a stable order
     * @param locale         language for the produced summary
     */
    GroupSummary summarizeGroup(Map<String, String> namedFragments, String locale);

    /**
     * Condenses a parent's skeleton into the context its children are analyzed with:
     * declared variables, aliases, cursors and the purpose of the block.
     *
     * @param skeleton        parent code with child spans replaced by placeholder markers
     * @param ancestorContext contexts already extracted for enclosing parents, may be empty
     */
    String extractContext(String skeleton, String ancestorContext, String locale);
}
