package org.flightplot.chart;

/**
 * How missing numeric cells are filled after a CSV has been read.
 * <p>
 * A cell is missing when it is empty or not a number. Whatever a strategy leaves open is
 * set to 0, so every column of the resulting table is complete.
 */
public enum FillStrategy {

    /** Drop every row that has a missing cell. */
    DROP,
    /** Repeat the previous value; leading gaps become 0. */
    FORWARD,
    /** Repeat the next value; trailing gaps become 0. */
    BACKWARD,
    /** Forward fill, then backward fill the leading gap. */
    FORWARD_BACKWARD,
    /** Column mean of the present values. */
    MEAN,
    /** Linear interpolation between neighbours; trailing gaps keep the last value, leading gaps become 0. */
    INTERPOLATE;

    /**
     * Fills the gaps ({@code NaN}) of one column in place.
     *
     * @param values column values.
     */
    void fill(double[] values) {
        switch (this) {
            case FORWARD -> forward(values);
            case BACKWARD -> backward(values);
            case FORWARD_BACKWARD -> {
                forward(values);
                backward(values);
            }
            case MEAN -> mean(values);
            case INTERPOLATE -> interpolate(values);
            case DROP -> {
                // rows were dropped by the reader
            }
        }
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                values[i] = 0.0;
            }
        }
    }

    private static void forward(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                values[i] = values[i - 1];
            }
        }
    }

    private static void backward(double[] values) {
        for (int i = values.length - 2; i >= 0; i--) {
            if (Double.isNaN(values[i])) {
                values[i] = values[i + 1];
            }
        }
    }

    private static void mean(double[] values) {
        double sum = 0;
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
                count++;
            }
        }
        if (count == 0) {
            return;
        }
        double mean = sum / count;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                values[i] = mean;
            }
        }
    }

    private static void interpolate(double[] values) {
        int previous = -1;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                continue;
            }
            if (previous >= 0 && i - previous > 1) {
                double step = (values[i] - values[previous]) / (i - previous);
                for (int k = previous + 1; k < i; k++) {
                    values[k] = values[previous] + step * (k - previous);
                }
            }
            previous = i;
        }
        if (previous >= 0) {
            for (int k = previous + 1; k < values.length; k++) {
                values[k] = values[previous];
            }
        }
    }
}
