package org.csu.svrf2pxl.analysis;

import java.util.List;

/**
 * One classified correspondence. Symbol lists are sorted by name.
 *
 * @param confidence 1.0 for exact name matches, lower for heuristic ones, 0 when there is no counterpart
 */
public record MappingRecord(
        Relationship relationship,
        List<String> sourceSymbols,
        List<String> targetSymbols,
        String rationale,
        double confidence
) {

    public MappingRecord {
        sourceSymbols = sourceSymbols.stream().sorted().toList();
        targetSymbols = targetSymbols.stream().sorted().toList();
    }

    public boolean involvesSource(String symbol) {
        return sourceSymbols.contains(symbol);
    }
}
