package org.flightplot.export;

/**
 * Lifecycle of one export request.
 * <p>
 * {@code RENDERING} and {@code AGGREGATING} overlap in time: workers keep rendering
 * while the aggregator collects their results. Every request ends in exactly one of
 * the terminal stages.
 */
public enum PipelineStage {
    CONFIGURING,
    SAMPLING,
    RENDERING,
    AGGREGATING,
    ENCODING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
