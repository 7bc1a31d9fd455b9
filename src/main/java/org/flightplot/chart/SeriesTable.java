package org.flightplot.chart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Column-oriented table of numeric series, one row per data point.
 * <p>
 * Values are complete: gaps were filled by the reader, so every column has
 * {@link #rowCount()} finite values. Columns that held no numbers at all are kept
 * (filled with zeros) and reported by {@link #isNumeric(String)}.
 * <p>
 * A table may carry a row index, typically its time column. The index is not a series:
 * it only labels rows.
 */
public final class SeriesTable {

    private final Map<String, double[]> columns;
    private final Map<String, Boolean> numeric;
    private final int rowCount;
    private final String indexName;
    private final List<String> indexLabels;

    /**
     * @param columns column values keyed by name, in display order; all of equal length.
     * @param numeric per column, whether it held at least one number.
     */
    public SeriesTable(Map<String, double[]> columns, Map<String, Boolean> numeric) {
        this(columns, numeric, null, List.of());
    }

    /**
     * @param columns     column values keyed by name, in display order; all of equal length.
     * @param numeric     per column, whether it held at least one number.
     * @param indexName   name of the index column, or {@code null} for row numbers.
     * @param indexLabels index text per row; ignored without an index name.
     */
    public SeriesTable(Map<String, double[]> columns, Map<String, Boolean> numeric,
                       String indexName, List<String> indexLabels) {
        int rows = -1;
        for (Map.Entry<String, double[]> column : columns.entrySet()) {
            if (rows >= 0 && column.getValue().length != rows) {
                throw new IllegalArgumentException("Column '" + column.getKey() + "' has "
                    + column.getValue().length + " rows, expected " + rows);
            }
            rows = column.getValue().length;
        }
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.numeric = Map.copyOf(numeric);
        if (rows < 0) {
            rows = indexName == null ? 0 : indexLabels.size();
        }
        this.rowCount = rows;
        if (indexName != null && indexLabels.size() != rowCount) {
            throw new IllegalArgumentException("Index '" + indexName + "' has " + indexLabels.size()
                + " labels, expected " + rowCount);
        }
        this.indexName = indexName;
        this.indexLabels = indexName == null ? List.of() : List.copyOf(indexLabels);
    }

    public int rowCount() {
        return rowCount;
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    /**
     * Returns the names of columns that held at least one number.
     *
     * @return numeric column names, in display order.
     */
    public List<String> numericColumnNames() {
        List<String> names = new ArrayList<>();
        for (String name : columns.keySet()) {
            if (isNumeric(name)) {
                names.add(name);
            }
        }
        return names;
    }

    public Optional<String> indexColumn() {
        return Optional.ofNullable(indexName);
    }

    /**
     * Returns the label of a row: its index text, or the row number without an index.
     *
     * @param row row index.
     * @return the row label.
     */
    public String rowLabel(int row) {
        if (indexName == null) {
            return Integer.toString(row);
        }
        return indexLabels.get(row);
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public boolean isNumeric(String name) {
        return numeric.getOrDefault(name, Boolean.FALSE);
    }

    /**
     * Returns one value.
     *
     * @param column column name.
     * @param row    row index.
     * @return the value.
     */
    public double value(String column, int row) {
        return column(column)[row];
    }

    private double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column '" + name + "'. Known columns: " + columns.keySet());
        }
        return values;
    }
}
