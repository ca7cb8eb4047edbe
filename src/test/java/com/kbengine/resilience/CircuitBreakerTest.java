package com.kbengine.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.kbengine.testing.MutableClock;

class CircuitBreakerTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));

    @Test
    void shouldOpenAfterThresholdConsecutiveFailures() {
        CircuitBreaker breaker = new CircuitBreaker("upsert", 3, Duration.ofSeconds(60), clock);

        fail(breaker);
        fail(breaker);
        assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
        assertTrue(breaker.acquire().isPresent());

        fail(breaker);
        assertEquals(CircuitBreaker.State.OPEN, breaker.state());
        assertFalse(breaker.acquire().isPresent());
    }

    @Test
    void successShouldResetFailureCount() {
        CircuitBreaker breaker = new CircuitBreaker("query", 3, Duration.ofSeconds(30), clock);

        fail(breaker);
        fail(breaker);
        breaker.acquire().orElseThrow().success();
        fail(breaker);

        assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
        assertEquals(1, breaker.consecutiveFailures());
    }

    @Test
    void shouldAllowExactlyOneProbeAfterResetWindow() {
        CircuitBreaker breaker = new CircuitBreaker("upsert", 1, Duration.ofSeconds(60), clock);
        fail(breaker);

        clock.advance(Duration.ofSeconds(59));
        assertFalse(breaker.acquire().isPresent());

        clock.advance(Duration.ofSeconds(1));
        CircuitBreaker.Permit probe = breaker.acquire().orElseThrow();
        assertTrue(probe.probe());
        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.state());
        assertFalse(breaker.acquire().isPresent());

        probe.success();
        assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
        assertTrue(breaker.acquire().isPresent());
    }

    @Test
    void failedProbeShouldReopenAndRestartWindow() {
        CircuitBreaker breaker = new CircuitBreaker("delete", 1, Duration.ofSeconds(60), clock);
        fail(breaker);
        clock.advance(Duration.ofSeconds(60));
        CircuitBreaker.Permit probe = breaker.acquire().orElseThrow();

        probe.failure();

        assertEquals(CircuitBreaker.State.OPEN, breaker.state());
        clock.advance(Duration.ofSeconds(30));
        assertFalse(breaker.acquire().isPresent());
        clock.advance(Duration.ofSeconds(30));
        assertTrue(breaker.acquire().isPresent());
    }

    @Test
    void releasedProbeShouldReopenAndAllowAnotherProbe() {
        CircuitBreaker breaker = new CircuitBreaker("upsert", 1, Duration.ofSeconds(60), clock);
        fail(breaker);
        clock.advance(Duration.ofSeconds(61));

        breaker.acquire().orElseThrow().release();

        assertEquals(CircuitBreaker.State.OPEN, breaker.state());
        CircuitBreaker.Permit next = breaker.acquire().orElseThrow();
        assertTrue(next.probe());
        next.success();
        assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
    }

    @Test
    void lateSuccessShouldNotCloseOpenBreaker() {
        CircuitBreaker breaker = new CircuitBreaker("upsert", 1, Duration.ofSeconds(60), clock);
        CircuitBreaker.Permit slow = breaker.acquire().orElseThrow();
        fail(breaker);

        slow.success();

        assertEquals(CircuitBreaker.State.OPEN, breaker.state());
    }

    @Test
    void lateSuccessShouldNotSettleAnotherCallersProbe() {
        CircuitBreaker breaker = new CircuitBreaker("upsert", 1, Duration.ofSeconds(60), clock);
        CircuitBreaker.Permit slow = breaker.acquire().orElseThrow();
        fail(breaker);
        clock.advance(Duration.ofSeconds(60));
        CircuitBreaker.Permit probe = breaker.acquire().orElseThrow();

        slow.success();
        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.state());

        probe.failure();
        assertEquals(CircuitBreaker.State.OPEN, breaker.state());
    }

    @Test
    void permitShouldSettleOnlyOnce() {
        CircuitBreaker breaker = new CircuitBreaker("upsert", 2, Duration.ofSeconds(60), clock);
        CircuitBreaker.Permit permit = breaker.acquire().orElseThrow();

        permit.failure();
        permit.failure();
        permit.release();

        assertEquals(1, breaker.consecutiveFailures());
        assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
    }

    @Test
    void concurrentCallersShouldGetSingleProbe() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("upsert", 1, Duration.ofSeconds(1), clock);
        fail(breaker);
        clock.advance(Duration.ofSeconds(2));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            results.add(executor.submit(() -> {
                start.await();
                return breaker.acquire().isPresent();
            }));
        }
        start.countDown();

        int granted = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                granted++;
            }
        }
        executor.shutdownNow();
        assertEquals(1, granted);
    }

    @Test
    void shouldRejectNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker("bad", 0, Duration.ofSeconds(1), clock));
    }

    private static void fail(CircuitBreaker breaker) {
        breaker.acquire().orElseThrow().failure();
    }
}
