package org.flightplot.chart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings for reading and cleaning a CSV export.
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * CsvReadOptions options = CsvReadOptions.builder()
 *     .headerRow(4)
 *     .skipBefore(10)
 *     .indexColumn("DATE")
 *     .fillStrategy(FillStrategy.INTERPOLATE)
 *     .build();
 * }</pre>
 */
public final class CsvReadOptions {

    /** Column names recognized as the time column when no index column is given. */
    public static final List<String> DEFAULT_TIME_COLUMNS = List.of(
        "Time", "DateTime", "Timestamp", "时间",
        "time", "datetime", "timestamp", "date",
        "Date", "TIME", "DATETIME", "TIMESTAMP");

    private final char delimiter;
    private final int headerRow;
    private final int skipBefore;
    private final int skipAfter;
    private final String indexColumn;
    private final boolean detectIndex;
    private final List<String> timeColumnNames;
    private final boolean removeDuplicates;
    private final FillStrategy fillStrategy;

    private CsvReadOptions(Builder builder) {
        this.delimiter = builder.delimiter;
        this.headerRow = builder.headerRow;
        this.skipBefore = builder.skipBefore;
        this.skipAfter = builder.skipAfter;
        this.indexColumn = builder.indexColumn;
        this.detectIndex = builder.detectIndex;
        this.timeColumnNames = Collections.unmodifiableList(new ArrayList<>(builder.timeColumnNames));
        this.removeDuplicates = builder.removeDuplicates;
        this.fillStrategy = builder.fillStrategy;
    }

    public static CsvReadOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public char delimiter() {
        return delimiter;
    }

    /**
     * Returns the position of the header among the non-blank lines; earlier lines are ignored.
     *
     * @return zero-based header line.
     */
    public int headerRow() {
        return headerRow;
    }

    public int skipBefore() {
        return skipBefore;
    }

    public int skipAfter() {
        return skipAfter;
    }

    /**
     * Returns the column explicitly chosen as row index, or {@code null} to detect one.
     *
     * @return index column name or {@code null}.
     */
    public String indexColumn() {
        return indexColumn;
    }

    public boolean detectIndex() {
        return detectIndex;
    }

    public List<String> timeColumnNames() {
        return timeColumnNames;
    }

    public boolean removeDuplicates() {
        return removeDuplicates;
    }

    public FillStrategy fillStrategy() {
        return fillStrategy;
    }

    /**
     * Builder for CsvReadOptions.
     */
    public static class Builder {
        private char delimiter = ',';
        private int headerRow = 0;
        private int skipBefore = 0;
        private int skipAfter = 0;
        private String indexColumn;
        private boolean detectIndex = true;
        private List<String> timeColumnNames = DEFAULT_TIME_COLUMNS;
        private boolean removeDuplicates = false;
        private FillStrategy fillStrategy = FillStrategy.FORWARD;

        public Builder delimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder headerRow(int headerRow) {
            this.headerRow = headerRow;
            return this;
        }

        /**
         * Sets the number of data rows dropped at the start, after the header.
         *
         * @param rows rows to drop.
         * @return This builder
         */
        public Builder skipBefore(int rows) {
            this.skipBefore = rows;
            return this;
        }

        /**
         * Sets the number of data rows dropped at the end.
         *
         * @param rows rows to drop.
         * @return This builder
         */
        public Builder skipAfter(int rows) {
            this.skipAfter = rows;
            return this;
        }

        public Builder indexColumn(String column) {
            this.indexColumn = column;
            return this;
        }

        /**
         * Enables or disables picking a known time column as row index.
         * Ignored when an index column is set explicitly.
         *
         * @param detect whether to detect a time column.
         * @return This builder
         */
        public Builder detectIndex(boolean detect) {
            this.detectIndex = detect;
            return this;
        }

        public Builder timeColumnNames(List<String> names) {
            this.timeColumnNames = names;
            return this;
        }

        public Builder removeDuplicates(boolean remove) {
            this.removeDuplicates = remove;
            return this;
        }

        public Builder fillStrategy(FillStrategy strategy) {
            this.fillStrategy = strategy;
            return this;
        }

        /**
         * Builds the options.
         *
         * @return immutable options.
         * @throws IllegalArgumentException if a row count is negative.
         */
        public CsvReadOptions build() {
            if (headerRow < 0 || skipBefore < 0 || skipAfter < 0) {
                throw new IllegalArgumentException("Header row and skipped rows must not be negative (header "
                    + headerRow + ", before " + skipBefore + ", after " + skipAfter + ")");
            }
            if (fillStrategy == null) {
                throw new IllegalArgumentException("fillStrategy must not be null");
            }
            return new CsvReadOptions(this);
        }
    }
}
