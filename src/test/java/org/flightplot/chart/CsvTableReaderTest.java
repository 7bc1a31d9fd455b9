package org.flightplot.chart;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CsvTableReader}.
 */
@Tag("unit")
class CsvTableReaderTest {

    @TempDir
    Path tempDir;

    private final CsvTableReader reader = new CsvTableReader();

    @Test
    void parsesColumnsInHeaderOrder() throws IOException {
        SeriesTable table = reader.parse("frame,altitude,speed\n0,100,250.5\n1,110,251\n2,120,252.25\n");

        assertThat(table.columnNames()).containsExactly("frame", "altitude", "speed");
        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.value("altitude", 2)).isEqualTo(120.0);
        assertThat(table.value("speed", 0)).isEqualTo(250.5);
        assertThat(table.indexColumn()).isEmpty();
        assertThat(table.rowLabel(2)).isEqualTo("2");
    }

    @Test
    @DisplayName("A known time column becomes the row index and is not a series")
    void detectsTimeColumn() throws IOException {
        SeriesTable table = reader.parse("altitude,Time\n100,08:00\n110,08:01\n");

        assertThat(table.indexColumn()).contains("Time");
        assertThat(table.columnNames()).containsExactly("altitude");
        assertThat(table.rowLabel(1)).isEqualTo("08:01");
    }

    @Test
    void explicitIndexColumnWinsOverDetection() throws IOException {
        CsvTableReader byFrame = new CsvTableReader(CsvReadOptions.builder().indexColumn("frame").build());

        SeriesTable table = byFrame.parse("time,frame,altitude\n0,f0,100\n1,f1,110\n");

        assertThat(table.indexColumn()).contains("frame");
        assertThat(table.columnNames()).containsExactly("time", "altitude");
        assertThat(table.rowLabel(0)).isEqualTo("f0");
    }

    @Test
    void indexDetectionCanBeDisabled() throws IOException {
        CsvTableReader plain = new CsvTableReader(CsvReadOptions.builder().detectIndex(false).build());

        SeriesTable table = plain.parse("time,altitude\n0,100\n");

        assertThat(table.indexColumn()).isEmpty();
        assertThat(table.columnNames()).containsExactly("time", "altitude");
    }

    @Test
    void unknownIndexColumnFails() {
        CsvTableReader byClock = new CsvTableReader(CsvReadOptions.builder().indexColumn("clock").build());

        assertThatThrownBy(() -> byClock.parse("time,altitude\n0,100\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("clock");
    }

    @Test
    @DisplayName("Lines before the header row are ignored")
    void headerRowSkipsPreamble() throws IOException {
        CsvTableReader reader = new CsvTableReader(CsvReadOptions.builder().headerRow(2).build());

        SeriesTable table = reader.parse("Flight decode export\nAircraft,B-1234\n\naltitude,speed\n100,250\n");

        assertThat(table.columnNames()).containsExactly("altitude", "speed");
        assertThat(table.rowCount()).isEqualTo(1);
        assertThatThrownBy(() -> new CsvTableReader(CsvReadOptions.builder().headerRow(5).build()).parse("a\n1\n"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("row 5");
    }

    @Test
    void skipsLeadingAndTrailingRows() throws IOException {
        CsvTableReader reader = new CsvTableReader(CsvReadOptions.builder().skipBefore(2).skipAfter(1).build());

        SeriesTable table = reader.parse("v\n1\n2\n3\n4\n5\n");

        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.value("v", 0)).isEqualTo(3.0);
        assertThat(table.value("v", 1)).isEqualTo(4.0);
        assertThat(new CsvTableReader(CsvReadOptions.builder().skipBefore(4).skipAfter(4).build())
            .parse("v\n1\n2\n").rowCount()).isZero();
    }

    @Test
    void negativeSkipIsRejected() {
        assertThatThrownBy(() -> CsvReadOptions.builder().skipBefore(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Duplicate rows are removed ignoring the index column")
    void removesDuplicateRows() throws IOException {
        CsvTableReader reader = new CsvTableReader(CsvReadOptions.builder().removeDuplicates(true).build());

        SeriesTable table = reader.parse("time,a,b\n0,1,2\n1,1,2\n2,1,3\n3,1,2\n");

        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.rowLabel(0)).isEqualTo("0");
        assertThat(table.rowLabel(1)).isEqualTo("2");
        assertThat(table.value("b", 1)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Dropping incomplete rows keeps only rows with every cell present")
    void dropsIncompleteRows() throws IOException {
        CsvTableReader reader = new CsvTableReader(CsvReadOptions.builder().fillStrategy(FillStrategy.DROP).build());

        SeriesTable table = reader.parse("time,phase,a\n0,CLIMB,1\n1,,2\n2,CRUISE,x\n3,CRUISE,4\n");

        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.rowLabel(1)).isEqualTo("3");
        assertThat(table.value("a", 1)).isEqualTo(4.0);
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
        "FORWARD,          0.0,  2.0, 2.0, 2.0, 6.0, 6.0",
        "BACKWARD,         2.0,  2.0, 6.0, 6.0, 6.0, 0.0",
        "FORWARD_BACKWARD, 2.0,  2.0, 2.0, 2.0, 6.0, 6.0",
        "MEAN,             4.0,  2.0, 4.0, 4.0, 6.0, 4.0",
        "INTERPOLATE,      0.0,  2.0, 3.333333, 4.666667, 6.0, 6.0"
    })
    void fillStrategies(FillStrategy strategy, double v0, double v1, double v2, double v3, double v4, double v5)
            throws IOException {
        CsvTableReader reader = new CsvTableReader(CsvReadOptions.builder().fillStrategy(strategy).build());

        SeriesTable table = reader.parse("v\n\"\"\n2\n\"\"\n?\n6\n\"\"\n");

        double[] values = new double[table.rowCount()];
        for (int row = 0; row < values.length; row++) {
            values[row] = table.value("v", row);
        }
        assertThat(values).containsExactly(new double[]{v0, v1, v2, v3, v4, v5}, within(1e-5));
    }

    @Test
    @DisplayName("Missing and non-numeric cells are filled forward, leading gaps become 0")
    void forwardFill() throws IOException {
        SeriesTable table = reader.parse("a,b\n,1\n5,x\n,\n7,3\n");

        assertThat(table.value("a", 0)).isZero();
        assertThat(table.value("a", 1)).isEqualTo(5.0);
        assertThat(table.value("a", 2)).isEqualTo(5.0);
        assertThat(table.value("a", 3)).isEqualTo(7.0);
        assertThat(table.value("b", 1)).isEqualTo(1.0);
        assertThat(table.value("b", 2)).isEqualTo(1.0);
        assertThat(table.value("b", 3)).isEqualTo(3.0);
    }

    @Test
    void shortRowsAreFilledForward() throws IOException {
        SeriesTable table = reader.parse("a,b\n1,2\n3\n");

        assertThat(table.value("b", 1)).isEqualTo(2.0);
    }

    @Test
    void textColumnsAreNotNumeric() throws IOException {
        SeriesTable table = reader.parse("label,value\nstart,1\nend,2\n");

        assertThat(table.isNumeric("label")).isFalse();
        assertThat(table.isNumeric("value")).isTrue();
        assertThat(table.numericColumnNames()).containsExactly("value");
    }

    @Test
    void quotedCellsMayContainDelimiters() throws IOException {
        SeriesTable table = reader.parse("\"name, unit\",\"v\"\"\"\n1,2\n");

        assertThat(table.columnNames()).containsExactly("name, unit", "v\"");
    }

    @Test
    void emptyAndDuplicateHeadersGetUniqueNames() throws IOException {
        SeriesTable table = reader.parse("x,,x\n1,2,3\n");

        assertThat(table.columnNames()).containsExactly("x", "column2", "x_2");
        assertThat(table.value("x_2", 0)).isEqualTo(3.0);
    }

    @Test
    void customDelimiter() throws IOException {
        SeriesTable table = new CsvTableReader(CsvReadOptions.builder().delimiter(';').build()).parse("a;b\n1,5;2\n");

        assertThat(table.columnNames()).containsExactly("a", "b");
        assertThat(table.value("b", 0)).isEqualTo(2.0);
    }

    @Test
    void emptyInputFails() {
        assertThatThrownBy(() -> reader.parse("\n\n")).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("UTF-8 files with a byte order mark are read without the mark")
    void utf8WithBom() throws IOException {
        Path file = tempDir.resolve("bom.csv");
        Files.write(file, ("\uFEFFheight,speed\r\n1,2\r\n").getBytes(StandardCharsets.UTF_8));

        SeriesTable table = reader.read(file);

        assertThat(table.columnNames()).containsExactly("height", "speed");
    }

    @Test
    @DisplayName("GB18030 encoded files are detected")
    void gb18030File() throws IOException {
        Path file = tempDir.resolve("gb.csv");
        Files.write(file, "高度,速度\n100,200\n110,210\n".getBytes(Charset.forName("GB18030")));

        SeriesTable table = reader.read(file);

        assertThat(table.columnNames()).containsExactly("高度", "速度");
        assertThat(table.value("速度", 1)).isEqualTo(210.0);
    }
}
