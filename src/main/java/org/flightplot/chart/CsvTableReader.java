package org.flightplot.chart;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a CSV export of flight-decode data into a {@link SeriesTable}.
 * <p>
 * Encodings are tried in order (UTF-8, GB18030, GBK) and the first one that decodes the
 * whole file without errors wins; a UTF-8 byte order mark is stripped. Reading then follows
 * the {@link CsvReadOptions}:
 * <ol>
 *   <li>lines before the header row are ignored</li>
 *   <li>{@code skipBefore} leading and {@code skipAfter} trailing data rows are dropped</li>
 *   <li>the index column (given, or the first known time column) is split off as row labels</li>
 *   <li>duplicate rows are removed, comparing all cells except the index</li>
 *   <li>cells that are empty or not numbers are filled with the {@link FillStrategy}</li>
 * </ol>
 */
public class CsvTableReader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    static final List<Charset> CANDIDATE_ENCODINGS = List.of(
        StandardCharsets.UTF_8, Charset.forName("GB18030"), Charset.forName("GBK"));

    private final CsvReadOptions options;

    public CsvTableReader() {
        this(CsvReadOptions.defaults());
    }

    public CsvTableReader(CsvReadOptions options) {
        this.options = options;
    }

    /**
     * Reads a CSV file.
     *
     * @param file the file.
     * @return the parsed table.
     * @throws IOException if the file cannot be read, decoded or has no header.
     */
    public SeriesTable read(Path file) throws IOException {
        String text = decode(Files.readAllBytes(file), file);
        return parse(text);
    }

    /**
     * Parses CSV text.
     *
     * @param text CSV content.
     * @return the parsed table.
     * @throws IOException              if the text has no line at the header row.
     * @throws IllegalArgumentException if the requested index column does not exist.
     */
    public SeriesTable parse(String text) throws IOException {
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\r?\n")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            throw new IOException("CSV has no header line");
        }
        if (options.headerRow() >= lines.size()) {
            throw new IOException("CSV has " + lines.size() + " line(s), no header at row " + options.headerRow());
        }

        List<String> header = uniqueNames(splitLine(lines.get(options.headerRow())));
        int width = header.size();
        int indexCol = indexColumn(header);

        List<List<String>> rows = new ArrayList<>();
        int first = options.headerRow() + 1 + options.skipBefore();
        int last = lines.size() - options.skipAfter();
        for (int i = first; i < last; i++) {
            rows.add(normalize(splitLine(lines.get(i)), width));
        }
        if (options.removeDuplicates()) {
            rows = withoutDuplicates(rows, indexCol);
        }

        double[][] values = new double[width][];
        boolean[] numeric = new boolean[width];
        for (int col = 0; col < width; col++) {
            values[col] = new double[rows.size()];
            for (int row = 0; row < rows.size(); row++) {
                double value = parseNumber(rows.get(row).get(col));
                values[col][row] = value;
                numeric[col] |= !Double.isNaN(value);
            }
        }

        if (options.fillStrategy() == FillStrategy.DROP) {
            List<Integer> kept = completeRows(rows, values, numeric, indexCol);
            rows = select(rows, kept);
            for (int col = 0; col < width; col++) {
                values[col] = select(values[col], kept);
            }
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        Map<String, Boolean> numericColumns = new LinkedHashMap<>();
        for (int col = 0; col < width; col++) {
            if (col == indexCol) {
                continue;
            }
            options.fillStrategy().fill(values[col]);
            columns.put(header.get(col), values[col]);
            numericColumns.put(header.get(col), numeric[col]);
        }

        if (indexCol < 0) {
            log.debug("Parsed CSV: {} column(s), {} row(s)", columns.size(), rows.size());
            return new SeriesTable(columns, numericColumns);
        }
        List<String> labels = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            labels.add(row.get(indexCol));
        }
        log.debug("Parsed CSV: {} column(s), {} row(s), index '{}'", columns.size(), rows.size(), header.get(indexCol));
        return new SeriesTable(columns, numericColumns, header.get(indexCol), labels);
    }

    private int indexColumn(List<String> header) {
        if (options.indexColumn() != null) {
            int col = header.indexOf(options.indexColumn());
            if (col < 0) {
                throw new IllegalArgumentException("Unknown index column '" + options.indexColumn()
                    + "'. Known columns: " + header);
            }
            return col;
        }
        if (options.detectIndex()) {
            for (String candidate : options.timeColumnNames()) {
                int col = header.indexOf(candidate);
                if (col >= 0) {
                    log.info("Detected time column '{}', using it as row index", candidate);
                    return col;
                }
            }
        }
        return -1;
    }

    private static List<String> normalize(List<String> cells, int width) {
        List<String> row = new ArrayList<>(width);
        for (int col = 0; col < width; col++) {
            row.add(col < cells.size() ? cells.get(col).trim() : "");
        }
        return row;
    }

    private static List<List<String>> withoutDuplicates(List<List<String>> rows, int indexCol) {
        Set<List<String>> seen = new HashSet<>();
        List<List<String>> unique = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> key = new ArrayList<>(row);
            if (indexCol >= 0) {
                key.remove(indexCol);
            }
            if (seen.add(key)) {
                unique.add(row);
            }
        }
        if (unique.size() < rows.size()) {
            log.debug("Removed {} duplicate row(s)", rows.size() - unique.size());
        }
        return unique;
    }

    private static List<Integer> completeRows(List<List<String>> rows, double[][] values, boolean[] numeric,
                                              int indexCol) {
        List<Integer> kept = new ArrayList<>(rows.size());
        for (int row = 0; row < rows.size(); row++) {
            boolean complete = true;
            for (int col = 0; col < values.length && complete; col++) {
                if (col == indexCol) {
                    continue;
                }
                complete = numeric[col] ? !Double.isNaN(values[col][row]) : !rows.get(row).get(col).isEmpty();
            }
            if (complete) {
                kept.add(row);
            }
        }
        if (kept.size() < rows.size()) {
            log.debug("Dropped {} row(s) with missing cells", rows.size() - kept.size());
        }
        return kept;
    }

    private static List<List<String>> select(List<List<String>> rows, List<Integer> kept) {
        List<List<String>> selected = new ArrayList<>(kept.size());
        for (int row : kept) {
            selected.add(rows.get(row));
        }
        return selected;
    }

    private static double[] select(double[] values, List<Integer> kept) {
        double[] selected = new double[kept.size()];
        for (int i = 0; i < kept.size(); i++) {
            selected[i] = values[kept.get(i)];
        }
        return selected;
    }

    private String decode(byte[] bytes, Path file) throws IOException {
        for (Charset charset : CANDIDATE_ENCODINGS) {
            try {
                String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
                log.debug("Decoded {} as {}", file, charset.name());
                return text;
            } catch (CharacterCodingException e) {
                log.debug("{} is not valid {}", file, charset.name());
            }
        }
        throw new IOException("Cannot decode " + file + " with any of " + CANDIDATE_ENCODINGS);
    }

    private static double parseNumber(String cell) {
        String trimmed = cell.trim();
        if (trimmed.isEmpty()) {
            return Double.NaN;
        }
        try {
            double value = Double.parseDouble(trimmed);
            return Double.isInfinite(value) ? Double.NaN : value;
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static List<String> uniqueNames(List<String> cells) {
        List<String> names = new ArrayList<>(cells.size());
        for (int col = 0; col < cells.size(); col++) {
            String trimmed = cells.get(col).trim();
            String base = trimmed.isEmpty() ? "column" + (col + 1) : trimmed;
            String unique = base;
            int suffix = 2;
            while (names.contains(unique)) {
                unique = base + "_" + suffix++;
            }
            names.add(unique);
        }
        return names;
    }

    List<String> splitLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == options.delimiter()) {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString());
        return cells;
    }
}
