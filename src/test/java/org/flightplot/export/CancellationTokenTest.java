package org.flightplot.export;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CancellationToken}.
 */
@Tag("unit")
class CancellationTokenTest {

    @Test
    void cancelIsMonotonic() {
        CancellationToken token = new CancellationToken();
        assertThat(token.isCancelled()).isFalse();

        assertThat(token.cancel()).isTrue();
        assertThat(token.cancel()).isFalse();
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void exactlyOneConcurrentCancelWins() throws Exception {
        CancellationToken token = new CancellationToken();
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (token.cancel()) {
                    winners.incrementAndGet();
                }
            });
            thread.start();
            threads.add(thread);
        }

        start.countDown();
        for (Thread thread : threads) {
            thread.join();
        }

        assertThat(winners.get()).isEqualTo(1);
    }
}
