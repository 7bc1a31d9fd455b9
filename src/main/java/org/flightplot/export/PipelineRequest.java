package org.flightplot.export;

import java.util.List;

/**
 * One export request.
 *
 * @param frames       frame descriptors in chart order; borrowed read-only by the render workers
 * @param tierName     quality tier name or label
 * @param cancellation cancel signal for this request only
 * @param <D>          frame descriptor type
 */
public record PipelineRequest<D>(List<D> frames, String tierName, CancellationToken cancellation) {

    public PipelineRequest {
        frames = List.copyOf(frames);
    }

    public PipelineRequest(List<D> frames, String tierName) {
        this(frames, tierName, new CancellationToken());
    }
}
