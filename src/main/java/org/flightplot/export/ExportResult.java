package org.flightplot.export;

import java.util.Optional;

/**
 * Terminal outcome of an export request.
 * <p>
 * Exactly one of: {@link Status#COMPLETED} with an artifact, {@link Status#CANCELLED},
 * or {@link Status#FAILED} with the failure that ended the request.
 */
public final class ExportResult {

    public enum Status {
        COMPLETED,
        CANCELLED,
        FAILED
    }

    private final Status status;
    private final PipelineStage endedIn;
    private final AnimatedArtifact artifact;
    private final ExportException failure;

    private ExportResult(Status status, PipelineStage endedIn, AnimatedArtifact artifact,
                         ExportException failure) {
        this.status = status;
        this.endedIn = endedIn;
        this.artifact = artifact;
        this.failure = failure;
    }

    static ExportResult completed(AnimatedArtifact artifact) {
        return new ExportResult(Status.COMPLETED, PipelineStage.ENCODING, artifact, null);
    }

    static ExportResult cancelled(PipelineStage endedIn) {
        return new ExportResult(Status.CANCELLED, endedIn, null, null);
    }

    static ExportResult failed(PipelineStage endedIn, ExportException failure) {
        return new ExportResult(Status.FAILED, endedIn, null, failure);
    }

    public Status status() {
        return status;
    }

    /**
     * Returns the last non-terminal stage the request was in.
     *
     * @return the stage in which the request ended.
     */
    public PipelineStage endedIn() {
        return endedIn;
    }

    public PipelineStage terminalStage() {
        return switch (status) {
            case COMPLETED -> PipelineStage.COMPLETED;
            case CANCELLED -> PipelineStage.CANCELLED;
            case FAILED -> PipelineStage.FAILED;
        };
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public Optional<AnimatedArtifact> artifact() {
        return Optional.ofNullable(artifact);
    }

    public Optional<ExportException> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return switch (status) {
            case COMPLETED -> "Completed: " + artifact;
            case CANCELLED -> "Cancelled during " + endedIn;
            case FAILED -> "Failed during " + endedIn + ": " + failure.getMessage();
        };
    }
}
