package org.flightplot.export;

import java.util.List;
import java.util.OptionalInt;

/**
 * Maps the total source frame count to a sampling stride and an optional cap.
 */
public interface FrameStepPolicy {

    /**
     * Returns the gap between consecutive selected frame indices.
     *
     * @param totalCount number of source frames.
     * @return stride, always at least 1.
     */
    int strideFor(int totalCount);

    /**
     * Returns the maximum number of strided entries to keep before the final
     * frame is appended, or empty for no cap.
     *
     * @param totalCount number of source frames.
     * @return the cap, if any.
     */
    OptionalInt capFor(int totalCount);

    /**
     * Stride proportional to the source size with no cap: {@code max(1, total / threshold)}.
     * Large inputs render more frames at a coarser stride.
     */
    record Threshold(int threshold) implements FrameStepPolicy {

        public Threshold {
            if (threshold < 1) {
                throw new IllegalArgumentException("Stride threshold must be positive, got " + threshold);
            }
        }

        @Override
        public int strideFor(int totalCount) {
            return Math.max(1, totalCount / threshold);
        }

        @Override
        public OptionalInt capFor(int totalCount) {
            return OptionalInt.empty();
        }
    }

    /**
     * Fixed lookup table keyed by coarse total-count buckets.
     * <p>
     * Buckets are checked in order; the first bucket whose {@code maxCount} is at
     * least the total count wins. The last bucket must be open-ended
     * ({@code maxCount} of {@link Integer#MAX_VALUE}). A bucket stride of 0 means
     * "derive the stride from the cap": {@code max(1, total / cap)}.
     */
    record Buckets(List<Bucket> buckets) implements FrameStepPolicy {

        public Buckets {
            if (buckets.isEmpty()) {
                throw new IllegalArgumentException("At least one bucket is required");
            }
            if (buckets.get(buckets.size() - 1).maxCount() != Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Last bucket must be open-ended");
            }
            buckets = List.copyOf(buckets);
        }

        @Override
        public int strideFor(int totalCount) {
            Bucket bucket = bucketFor(totalCount);
            if (bucket.stride() > 0) {
                return bucket.stride();
            }
            return Math.max(1, totalCount / bucket.cap());
        }

        @Override
        public OptionalInt capFor(int totalCount) {
            return OptionalInt.of(bucketFor(totalCount).cap());
        }

        Bucket bucketFor(int totalCount) {
            for (Bucket bucket : buckets) {
                if (totalCount <= bucket.maxCount()) {
                    return bucket;
                }
            }
            return buckets.get(buckets.size() - 1);
        }
    }

    /**
     * One row of a {@link Buckets} table.
     *
     * @param maxCount inclusive upper bound of the total count
     * @param stride   fixed stride, or 0 to derive it from the cap
     * @param cap      maximum strided entries
     */
    record Bucket(int maxCount, int stride, int cap) {

        public Bucket {
            if (stride < 0 || cap < 1) {
                throw new IllegalArgumentException(
                    "Bucket needs stride >= 0 and cap >= 1, got stride=" + stride + ", cap=" + cap);
            }
        }
    }
}
