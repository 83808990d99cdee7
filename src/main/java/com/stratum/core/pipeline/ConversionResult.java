package com.stratum.core.pipeline;

import java.util.List;

/**
 * Transformed text of one file.
 *
 * @param fileId                the file
 * @param text                  reassembled output
 * @param unitCount             units sent to the transformation service
 * @param unmatchedPlaceholders marker lines left unfilled, by source start line
 */
public record ConversionResult(String fileId, String text, int unitCount, List<Integer> unmatchedPlaceholders) {

    public ConversionResult {
        unmatchedPlaceholders = List.copyOf(unmatchedPlaceholders);
    }
}
