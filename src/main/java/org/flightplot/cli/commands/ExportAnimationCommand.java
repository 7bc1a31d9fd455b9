package org.flightplot.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.flightplot.chart.ChartFrame;
import org.flightplot.chart.CsvReadOptions;
import org.flightplot.chart.CsvTableReader;
import org.flightplot.chart.FillStrategy;
import org.flightplot.chart.LineChartRasterizer;
import org.flightplot.chart.SeriesTable;
import org.flightplot.chart.TimeSeriesChart;
import org.flightplot.cli.CommandLineInterface;
import org.flightplot.cli.config.LoggingConfigurator;
import org.flightplot.export.AnimatedArtifact;
import org.flightplot.export.CancellationToken;
import org.flightplot.export.ExportPipeline;
import org.flightplot.export.ExportResult;
import org.flightplot.export.IProgressListener;
import org.flightplot.export.PipelineRequest;
import org.flightplot.export.PipelineStage;
import org.flightplot.export.ProgressEvent;
import org.flightplot.export.QualityProfileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Exports columns of a CSV file as an animated line chart.
 * <p>
 * Each data row becomes one frame showing the series up to that row. Before charting, the
 * rows can be trimmed, deduplicated and gap-filled, and a time column becomes the row
 * labels of the x axis. The quality tier decides how many frames are rendered, their size
 * and the color encoding. Ctrl-C cancels the export; nothing is written in that case.
 */
@Command(name = "export", description = "Exports CSV columns as an animated GIF line chart.")
public class ExportAnimationCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportAnimationCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--input"}, required = true, description = "CSV file with a header row.")
    private File inputFile;

    @Option(names = "--columns", split = ",",
        description = "Comma-separated column names to plot. Default: the first numeric columns, "
            + "up to flightplot.csv.max-default-series")
    private List<String> columns;

    @Option(names = {"-q", "--quality"},
        description = "Quality tier (see 'flightplot tiers'). Default: flightplot.cli.default-tier")
    private String quality;

    @Option(names = {"-o", "--out"}, description = "Output filename.", defaultValue = "chart.gif")
    private File outputFile;

    @Option(names = "--title", description = "Chart title.", defaultValue = "")
    private String title;

    @Option(names = "--delimiter", description = "CSV field delimiter. Default: ','", defaultValue = ",")
    private char delimiter;

    @Option(names = "--header-row", defaultValue = "0",
        description = "Zero-based line of the header among the non-blank lines. Default: 0")
    private int headerRow;

    @Option(names = "--skip-before", defaultValue = "0", description = "Data rows to drop at the start.")
    private int skipBefore;

    @Option(names = "--skip-after", defaultValue = "0", description = "Data rows to drop at the end.")
    private int skipAfter;

    @Option(names = "--index-column",
        description = "Column that labels the rows. Default: the first known time column, if any.")
    private String indexColumn;

    @Option(names = "--no-index-detection", description = "Do not pick a time column as row index.")
    private boolean noIndexDetection;

    @Option(names = "--drop-duplicates", description = "Remove duplicate data rows.")
    private boolean dropDuplicates;

    @Option(names = "--fill", defaultValue = "FORWARD",
        description = "Missing value handling: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    private FillStrategy fill;

    @Option(names = "--threads", description = "Maximum number of render threads. Default: flightplot.export.max-workers")
    private Integer threads;

    @Option(names = "--no-labels", description = "Omit title, legend and value labels.")
    private boolean noLabels;

    @Option(names = "--verbose", description = "Show debug output.")
    private boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String tier;
        int maxWorkers;
        long progressInterval;
        QualityProfileResolver resolver;
        CsvReadOptions readOptions;
        int maxDefaultSeries;
        try {
            Config config = parent.getConfig();
            tier = quality != null ? quality : config.getString("flightplot.cli.default-tier");
            maxWorkers = threads != null ? threads : config.getInt("flightplot.export.max-workers");
            progressInterval = config.getDuration("flightplot.cli.progress-interval", TimeUnit.MILLISECONDS);
            resolver = QualityProfileResolver.fromApplicationConfig(config);
            maxDefaultSeries = config.getInt("flightplot.csv.max-default-series");
            readOptions = CsvReadOptions.builder()
                .delimiter(delimiter)
                .headerRow(headerRow)
                .skipBefore(skipBefore)
                .skipAfter(skipAfter)
                .indexColumn(indexColumn)
                .detectIndex(!noIndexDetection)
                .timeColumnNames(config.getStringList("flightplot.csv.time-columns"))
                .removeDuplicates(dropDuplicates)
                .fillStrategy(fill)
                .build();
        } catch (ConfigException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }
        if (verbose) {
            LoggingConfigurator.enableDebug();
        }
        if (maxWorkers < 1) {
            err.println("Thread count must be at least 1, got " + maxWorkers);
            return CommandLineInterface.EXIT_FAILURE;
        }

        TimeSeriesChart chart;
        try {
            SeriesTable table = new CsvTableReader(readOptions).read(inputFile.toPath());
            chart = columns == null || columns.isEmpty()
                ? TimeSeriesChart.ofNumericColumns(table, maxDefaultSeries, title)
                : new TimeSeriesChart(table, columns, title);
        } catch (IOException e) {
            err.println("Failed to read " + inputFile + ": " + e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }

        ExportPipeline<ChartFrame> pipeline =
            new ExportPipeline<>(resolver, new LineChartRasterizer(!noLabels), maxWorkers);

        CancellationToken cancellation = new CancellationToken();
        PipelineRequest<ChartFrame> request = new PipelineRequest<>(chart.frames(), tier, cancellation);

        out.println(String.format("Exporting %d point(s) of %s from %s with tier '%s'",
            chart.pointCount(), String.join(", ", chart.series()), inputFile.getName(), tier));
        out.flush();

        Thread shutdownHook = createShutdownHook(cancellation);
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        ExportResult result;
        try {
            result = pipeline.export(request, new ConsoleProgress(out, progressInterval));
        } finally {
            removeShutdownHook(shutdownHook);
        }

        return switch (result.status()) {
            case COMPLETED -> write(result.artifact().orElseThrow(), out, err);
            case CANCELLED -> {
                out.println("Export cancelled during " + result.endedIn() + ". Nothing written.");
                out.flush();
                yield CommandLineInterface.EXIT_CANCELLED;
            }
            case FAILED -> {
                err.println("Export failed during " + result.endedIn() + ": "
                    + result.failure().map(Throwable::getMessage).orElse("unknown error"));
                err.flush();
                yield CommandLineInterface.EXIT_FAILURE;
            }
        };
    }

    private int write(AnimatedArtifact artifact, PrintWriter out, PrintWriter err) {
        Path target = outputFile.toPath();
        try {
            Path dir = target.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Files.write(target, artifact.bytes());
        } catch (IOException e) {
            err.println("Failed to write " + outputFile.getAbsolutePath() + ": " + e.getMessage());
            err.flush();
            return CommandLineInterface.EXIT_FAILURE;
        }
        log.debug("Wrote {}", artifact);
        out.println(String.format("Animation created: %s (%d frames, %dx%d, %s)",
            outputFile.getAbsolutePath(), artifact.frameCount(), artifact.width(), artifact.height(),
            artifact.formattedSize()));
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }

    private Thread createShutdownHook(CancellationToken cancellation) {
        return new Thread(() -> {
            if (cancellation.cancel()) {
                System.out.println("\n\nCancellation requested...");
            }
        }, "export-shutdown-hook");
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down
            log.debug("Shutdown hook not removed: {}", e.getMessage());
        }
    }

    /**
     * Console progress bar, redrawn at most once per interval and on the last frame.
     */
    static final class ConsoleProgress implements IProgressListener {

        private static final int BAR_WIDTH = 40;

        private final PrintWriter out;
        private final long intervalMs;
        private final long startTime = System.currentTimeMillis();
        private long lastUpdate;
        private boolean drawn;

        ConsoleProgress(PrintWriter out, long intervalMs) {
            this.out = out;
            this.intervalMs = intervalMs;
        }

        @Override
        public void onProgress(ProgressEvent event) {
            long now = System.currentTimeMillis();
            boolean last = event.completed() >= event.total();
            if (!last && now - lastUpdate < intervalMs) {
                return;
            }
            lastUpdate = now;
            out.print(render(event, now - startTime));
            out.flush();
            drawn = true;
        }

        @Override
        public void onStageChanged(PipelineStage stage) {
            if (stage == PipelineStage.ENCODING || stage.isTerminal()) {
                if (drawn) {
                    out.println();
                    drawn = false;
                }
                if (stage == PipelineStage.ENCODING) {
                    out.println("Encoding...");
                }
                out.flush();
            }
        }

        static String render(ProgressEvent event, long elapsedMs) {
            int total = Math.max(1, event.total());
            int completed = Math.min(event.completed(), total);
            int filled = completed * BAR_WIDTH / total;
            StringBuilder bar = new StringBuilder("[");
            for (int i = 0; i < BAR_WIDTH; i++) {
                bar.append(i < filled ? "=" : " ");
            }
            bar.append("]");
            double fps = elapsedMs > 0 ? completed * 1000.0 / elapsedMs : 0;
            long remaining = fps > 0 ? (long) ((total - completed) * 1000.0 / fps) : -1;
            return String.format("\r%s %d%% | %s | Frame %d/%d | %.1f fps | Elapsed: %s | ETA: %s",
                bar, completed * 100 / total, event.tierLabel(), completed, total, fps,
                formatTime(elapsedMs), formatTime(remaining));
        }

        static String formatTime(long ms) {
            if (ms < 0) return "?";
            long sec = ms / 1000;
            long h = sec / 3600;
            long m = (sec % 3600) / 60;
            long s = sec % 60;
            return h > 0 ? String.format("%d:%02d:%02d", h, m, s) : String.format("%d:%02d", m, s);
        }
    }
}
