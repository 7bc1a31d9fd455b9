package org.flightplot.export;

import java.util.OptionalInt;

/**
 * A quality profile together with the concrete sampling parameters for one source size.
 *
 * @param profile    the tier's profile
 * @param totalCount number of source frames the parameters were computed for
 * @param stride     gap between selected frame indices
 * @param cap        maximum strided entries before the final frame is appended
 */
public record ResolvedProfile(QualityProfile profile, int totalCount, int stride, OptionalInt cap) {

    /**
     * Runs the {@link FrameSampler} with these parameters.
     *
     * @return the selected frame indices.
     */
    public SampledIndices sample() {
        return FrameSampler.sample(totalCount, stride, cap.isPresent() ? cap.getAsInt() : null);
    }
}
