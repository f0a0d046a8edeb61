package org.csu.svrf2pxl.analysis;

import lombok.Builder;
import lombok.Getter;

/**
 * Knobs for {@link VariableRelationshipClassifier}.
 */
@Getter
@Builder(toBuilder = true)
public class ClassifierOptions {

    /** match names ignoring case when no exact match exists */
    @Builder.Default
    private final boolean ignoreCase = true;

    /** separator before the variant suffix, as in {@code metal1_wide} */
    @Builder.Default
    private final String prefixSeparator = "_";

    /** unmatched symbols needed before a shared prefix counts as a consolidation */
    @Builder.Default
    private final int minConsolidationGroup = 2;

    @Builder.Default
    private final boolean semanticEquivalence = true;

    @Builder.Default
    private final double thresholdTolerance = 1e-9;

    public static ClassifierOptions defaults() {
        return ClassifierOptions.builder().build();
    }
}
