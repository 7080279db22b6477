package com.ryuqq.verhoeff.testkit.contract;

import com.ryuqq.verhoeff.core.Verhoeff;
import com.ryuqq.verhoeff.core.engine.ChecksumEngine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: concurrent use of the shared engine.
 *
 * <p>The engine and lookup tables are shared without synchronization.
 * Concurrent callers must observe exactly the same results as a single thread.</p>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
class ConcurrencyContractTest extends AbstractDetectionContractTest {

    private static final int THREADS = 8;
    private static final int ITERATIONS = 2000;

    @Test
    void testConcurrency_SharedEngine_MatchesSequentialResults() throws Exception {
        // Given: 단일 스레드 기준값
        int[] expected = new int[ITERATIONS];
        for (int i = 0; i < ITERATIONS; i++) {
            expected[i] = engine.compute(payloadFor(i)).orElseThrow();
        }

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger mismatches = new AtomicInteger(0);
        List<Future<?>> futures = new ArrayList<>();

        try {
            // When
            for (int t = 0; t < THREADS; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < ITERATIONS; i++) {
                        String payload = payloadFor(i);
                        int check = ChecksumEngine.INSTANCE.compute(payload).orElseThrow();
                        if (check != expected[i] || !Verhoeff.validate(payload + check)) {
                            mismatches.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertThat(mismatches.get()).isZero();
    }

    private static String payloadFor(int i) {
        return String.format("%011d", (long) i * 104729L);
    }
}
