package com.vidnyan.depindex.application.support;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SingleFlightTest {

    @Test
    void execute_ConcurrentCallersShouldShareOneRun() throws Exception {
        SingleFlight<Integer> flight = new SingleFlight<>();
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Future<Integer> leader = pool.submit(() -> flight.execute(() -> {
                runs.incrementAndGet();
                started.countDown();
                await(release);
                return 42;
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            List<Future<Integer>> followers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                followers.add(pool.submit(() -> flight.execute(() -> {
                    runs.incrementAndGet();
                    return -1;
                })));
            }
            // followers are parked on the leader's future
            Thread.sleep(300);
            release.countDown();

            assertEquals(42, leader.get(5, TimeUnit.SECONDS));
            for (Future<Integer> f : followers) {
                assertEquals(42, f.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, runs.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void execute_ShouldStartNewRunAfterCompletion() {
        SingleFlight<Integer> flight = new SingleFlight<>();
        AtomicInteger runs = new AtomicInteger();

        flight.execute(runs::incrementAndGet);
        flight.execute(runs::incrementAndGet);

        assertEquals(2, runs.get());
    }

    @Test
    void execute_ShouldPropagateFailureAndReset() {
        SingleFlight<String> flight = new SingleFlight<>();

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> flight.execute(() -> { throw new IllegalStateException("boom"); }));

        assertEquals("boom", e.getMessage());
        assertEquals("ok", flight.execute(() -> "ok"));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
