package com.smurthy.ai.insights.extract;

import java.util.Map;
import java.util.Optional;

/**
 * Where to find the type code and the value inside one metric slot, and what each type code means.
 *
 * @param typeCodeIndex   index of the integer type code
 * @param firstValueIndex index at which the search for the numeric value starts
 * @param typeCodes       type code to metric
 */
public record MetricSlotLayout(int typeCodeIndex, int firstValueIndex, Map<Integer, MetricKind> typeCodes) {

    public MetricSlotLayout {
        if (typeCodeIndex < 0 || firstValueIndex < 0) {
            throw new IllegalArgumentException("Metric slot indexes must not be negative");
        }
        typeCodes = Map.copyOf(typeCodes);
    }

    public Optional<MetricKind> kindFor(int typeCode) {
        return Optional.ofNullable(typeCodes.get(typeCode));
    }
}
