package com.smurthy.ai.insights.extract;

/**
 * Versioned lookup of every upstream position the decoder and extractor depend on.
 * An upstream layout change is absorbed by shipping a new table version.
 */
public interface PositionTable {

    String version();

    ProcedureLayout layout(SearchConsoleProcedure procedure);

    MetricSlotLayout metricSlots();
}
