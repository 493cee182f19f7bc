package ru.aritmos.presencegateway.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SerialExecutorTest {

    @Test
    void shouldRunTasksInSubmissionOrderOnSharedPool() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            SerialExecutor serial = new SerialExecutor(pool);
            List<Integer> seen = new CopyOnWriteArrayList<>();
            AtomicInteger concurrent = new AtomicInteger();
            AtomicInteger maxConcurrent = new AtomicInteger();
            CountDownLatch done = new CountDownLatch(200);

            for (int i = 0; i < 200; i++) {
                int n = i;
                serial.execute(() -> {
                    int c = concurrent.incrementAndGet();
                    maxConcurrent.accumulateAndGet(c, Math::max);
                    seen.add(n);
                    concurrent.decrementAndGet();
                    done.countDown();
                });
            }

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(1, maxConcurrent.get());
            List<Integer> expected = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                expected.add(i);
            }
            assertEquals(expected, seen);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldContinueAfterFailingTask() {
        SerialExecutor serial = new SerialExecutor(Runnable::run);
        List<String> seen = new ArrayList<>();

        serial.execute(() -> seen.add("a"));
        serial.execute(() -> {
            throw new IllegalStateException("boom");
        });
        serial.execute(() -> seen.add("b"));

        assertEquals(List.of("a", "b"), seen);
    }
}
