package org.flightplot.export;

import java.util.Arrays;

/**
 * Selects which source frames are rendered.
 * <p>
 * Builds {@code 0, stride, 2*stride, ...} below {@code totalCount}, truncates to
 * {@code cap} entries when a cap is given, then appends {@code totalCount - 1} unless it
 * is already last, so the final chart state is always part of the animation. The
 * result therefore has at most {@code cap + 1} entries.
 * <p>
 * A total count of zero yields {@code [0]}.
 */
public final class FrameSampler {

    private FrameSampler() {
    }

    /**
     * Samples frame indices. Pure: equal arguments always give equal results.
     *
     * @param totalCount number of source frames, not negative.
     * @param stride     gap between selected indices, at least 1.
     * @param cap        maximum strided entries, or {@code null} for no cap.
     * @return the selected indices.
     */
    public static SampledIndices sample(int totalCount, int stride, Integer cap) {
        if (totalCount < 0) {
            throw new IllegalArgumentException("Total count must not be negative: " + totalCount);
        }
        if (stride < 1) {
            throw new IllegalArgumentException("Stride must be at least 1: " + stride);
        }
        if (cap != null && cap < 1) {
            throw new IllegalArgumentException("Cap must be at least 1: " + cap);
        }
        if (totalCount == 0) {
            return new SampledIndices(new int[]{0});
        }

        int strided = (totalCount - 1) / stride + 1;
        int kept = cap != null ? Math.min(strided, cap) : strided;

        int last = totalCount - 1;
        int lastStrided = (kept - 1) * stride;
        int[] indices = new int[lastStrided == last ? kept : kept + 1];
        for (int i = 0; i < kept; i++) {
            indices[i] = i * stride;
        }
        indices[indices.length - 1] = last;
        return new SampledIndices(indices);
    }

    /**
     * Convenience overload without a cap.
     *
     * @param totalCount number of source frames.
     * @param stride     gap between selected indices.
     * @return the selected indices.
     */
    public static SampledIndices sample(int totalCount, int stride) {
        return sample(totalCount, stride, null);
    }

    static String describe(SampledIndices indices) {
        int[] values = indices.toArray();
        if (values.length <= 12) {
            return Arrays.toString(values);
        }
        return "[" + values[0] + ", " + values[1] + ", ... , " + values[values.length - 1] + "] ("
            + values.length + " frames)";
    }
}
