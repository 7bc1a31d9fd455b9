package org.flightplot.export;

import java.util.Arrays;

/**
 * Ordered, strictly increasing frame positions selected for rendering.
 * <p>
 * The slot order of the render pipeline is the order of this sequence: slot
 * {@code k} always holds the frame at {@code get(k)}.
 */
public final class SampledIndices {

    private final int[] indices;

    SampledIndices(int[] indices) {
        this.indices = indices;
    }

    /**
     * Creates a sequence from explicit positions.
     *
     * @param indices strictly increasing, non-negative positions.
     * @return the sequence.
     * @throws IllegalArgumentException if the positions are not strictly increasing.
     */
    public static SampledIndices of(int... indices) {
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || (i > 0 && indices[i] <= indices[i - 1])) {
                throw new IllegalArgumentException("Indices must be non-negative and strictly increasing: "
                    + Arrays.toString(indices));
            }
        }
        return new SampledIndices(indices.clone());
    }

    public int size() {
        return indices.length;
    }

    public int get(int slot) {
        return indices[slot];
    }

    public int last() {
        return indices[indices.length - 1];
    }

    public int[] toArray() {
        return indices.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SampledIndices other)) return false;
        return Arrays.equals(indices, other.indices);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(indices);
    }

    @Override
    public String toString() {
        return Arrays.toString(indices);
    }
}
