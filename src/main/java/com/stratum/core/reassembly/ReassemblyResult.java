package com.stratum.core.reassembly;

import java.util.List;

/**
 * Linear output of a reassembly.
 *
 * @param text                  the spliced output
 * @param unmatchedPlaceholders start lines of markers no child ever filled; they remain in {@code text}
 */
public record ReassemblyResult(String text, List<Integer> unmatchedPlaceholders) {

    public ReassemblyResult {
        unmatchedPlaceholders = List.copyOf(unmatchedPlaceholders);
    }

    public boolean clean() {
        return unmatchedPlaceholders.isEmpty();
    }
}
