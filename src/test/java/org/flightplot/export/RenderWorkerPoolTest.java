package org.flightplot.export;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link RenderWorkerPool}.
 */
@Tag("unit")
class RenderWorkerPoolTest {

    private static final QualityProfile PROFILE = new QualityProfile("test", "Test", 16, 12, 1.0,
        OptionalInt.empty(), new FrameStepPolicy.Threshold(10), 100, ColorEncoding.fullColor());

    private final List<Integer> frames = IntStream.range(0, 40).boxed().collect(Collectors.toList());

    private final Logger poolLogger = (Logger) LoggerFactory.getLogger(RenderWorkerPool.class);
    private final ListAppender<ILoggingEvent> logEvents = new ListAppender<>();

    @BeforeEach
    void attachLogAppender() {
        logEvents.start();
        poolLogger.addAppender(logEvents);
    }

    @AfterEach
    void detachLogAppender() {
        poolLogger.detachAppender(logEvents);
        logEvents.stop();
    }

    @Test
    void workerCountIsBoundedBySelectionAndMaximum() {
        RenderWorkerPool<Integer> pool = new RenderWorkerPool<>(new IndexColorRasterizer());

        assertThat(pool.workerCountFor(3)).isEqualTo(3);
        assertThat(pool.workerCountFor(20)).isEqualTo(RenderWorkerPool.DEFAULT_MAX_WORKERS);
        assertThat(pool.workerCountFor(0)).isEqualTo(1);
        assertThat(new RenderWorkerPool<>(new IndexColorRasterizer(), 2).workerCountFor(20)).isEqualTo(2);
        assertThatThrownBy(() -> new RenderWorkerPool<>(new IndexColorRasterizer(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void publishesOneResultPerSlot() throws Exception {
        SampledIndices indices = FrameSampler.sample(40, 3);
        PipelineState state = new PipelineState(new CancellationToken(), indices.size());

        RenderWorkerPool.RenderBatch batch =
            new RenderWorkerPool<>(new IndexColorRasterizer(Set.of(9), 5), 4).start(frames, indices, PROFILE, state);

        List<RenderResult> results = drain(batch);
        assertThat(batch.workerCount()).isEqualTo(4);
        assertThat(results).hasSize(indices.size());
        assertThat(results).extracting(RenderResult::slotIndex).doesNotHaveDuplicates();
        for (RenderResult result : results) {
            assertThat(result.frameIndex()).isEqualTo(indices.get(result.slotIndex()));
            if (result.frameIndex() == 9) {
                assertThat(result.status()).isEqualTo(RenderResult.Status.FAILED);
                assertThat(result.hasImage()).isFalse();
            } else {
                assertThat(result.status()).isEqualTo(RenderResult.Status.RENDERED);
                assertThat(IndexColorRasterizer.indexOf(result.image().getRGB(0, 0))).isEqualTo(result.frameIndex());
                assertThat(result.image().getWidth()).isEqualTo(16);
            }
        }
        await().atMost(Duration.ofSeconds(5)).until(batch::isTerminated);

        // Skipped frames are reported at WARN without a stack trace
        List<ILoggingEvent> warnings = logEvents.list.stream()
            .filter(event -> event.getLevel() == Level.WARN)
            .collect(Collectors.toList());
        assertThat(warnings).singleElement().satisfies(event -> {
            assertThat(event.getFormattedMessage()).contains("Skipping frame 9").contains("Frame 9 is broken");
            assertThat(event.getThrowableProxy()).isNull();
        });
    }

    @Test
    void workersRunOnNamedDaemonThreads() throws Exception {
        Set<String> threadNames = new HashSet<>();
        IFrameRasterizer<Integer> recording = new IndexColorRasterizer() {
            @Override
            public IFrameRasterizer<Integer> createThreadInstance() {
                synchronized (threadNames) {
                    threadNames.add(Thread.currentThread().getName());
                    assertThat(Thread.currentThread().isDaemon()).isTrue();
                }
                return new IndexColorRasterizer();
            }
        };
        SampledIndices indices = FrameSampler.sample(40, 1);
        PipelineState state = new PipelineState(new CancellationToken(), indices.size());

        drain(new RenderWorkerPool<>(recording, 3).start(frames, indices, PROFILE, state));

        synchronized (threadNames) {
            assertThat(threadNames).isNotEmpty().hasSizeLessThanOrEqualTo(3);
            assertThat(threadNames).allMatch(name -> name.startsWith("frame-render-"));
        }
    }

    @Test
    void cancelledRequestSkipsFrames() throws Exception {
        CancellationToken token = new CancellationToken();
        token.cancel();
        SampledIndices indices = FrameSampler.sample(40, 5);
        PipelineState state = new PipelineState(token, indices.size());

        List<RenderResult> results = drain(
            new RenderWorkerPool<>(new IndexColorRasterizer(), 2).start(frames, indices, PROFILE, state));

        assertThat(results).hasSize(indices.size());
        assertThat(results).allMatch(r -> r.status() == RenderResult.Status.SKIPPED);
    }

    @Test
    void abandonStopsOutstandingWork() {
        SampledIndices indices = FrameSampler.sample(40, 1);
        PipelineState state = new PipelineState(new CancellationToken(), indices.size());

        RenderWorkerPool.RenderBatch batch = new RenderWorkerPool<>(new IndexColorRasterizer(Set.of(), 40), 2)
            .start(frames, indices, PROFILE, state);
        batch.abandon();

        await().atMost(Duration.ofSeconds(5)).until(batch::isTerminated);
        assertThat(batch.completions().size()).isLessThan(indices.size());
    }

    private static List<RenderResult> drain(RenderWorkerPool.RenderBatch batch) throws InterruptedException {
        List<RenderResult> results = new ArrayList<>();
        for (int i = 0; i < batch.expectedResults(); i++) {
            RenderResult result = batch.completions().poll(10, TimeUnit.SECONDS);
            assertThat(result).as("result %d", i).isNotNull();
            results.add(result);
        }
        return results;
    }
}
