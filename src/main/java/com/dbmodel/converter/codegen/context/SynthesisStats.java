package com.dbmodel.converter.codegen.context;

import lombok.Builder;
import lombok.Value;

/**
 * Counts of destination objects produced by one synthesis.
 */
@Value
@Builder(toBuilder = true)
public class SynthesisStats {
    int tableCount;
    int columnCount;
    int relationshipCount;
    int indexCount;
    int domainCount;
    int enumCount;
    int triggerCount;
}
