package com.kbengine.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consecutive-failure circuit breaker. Callers obtain a {@link Permit} and settle it exactly
 * once; only the permit that opened HALF_OPEN may close or reopen the breaker from there.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final AtomicReference<Snapshot> state = new AtomicReference<>(Snapshot.closed(0));

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1 for " + name);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    public Optional<Permit> acquire() {
        while (true) {
            Snapshot current = state.get();
            switch (current.state()) {
                case CLOSED:
                    return Optional.of(new Permit(false));
                case HALF_OPEN:
                    return Optional.empty();
                case OPEN:
                default:
                    long now = clock.millis();
                    if (now - current.openedAtMs() < resetTimeout.toMillis()) {
                        return Optional.empty();
                    }
                    Snapshot probing = new Snapshot(State.HALF_OPEN, current.consecutiveFailures(), current.openedAtMs());
                    if (state.compareAndSet(current, probing)) {
                        log.warn("circuit.half-open breaker={}", name);
                        return Optional.of(new Permit(true));
                    }
            }
        }
    }

    public State state() {
        return state.get().state();
    }

    public int consecutiveFailures() {
        return state.get().consecutiveFailures();
    }

    public String name() {
        return name;
    }

    private void onSuccess(boolean probe) {
        while (true) {
            Snapshot current = state.get();
            State expected = probe ? State.HALF_OPEN : State.CLOSED;
            if (current.state() != expected) {
                // a late result from a call admitted before the breaker moved on
                return;
            }
            if (!probe && current.consecutiveFailures() == 0) {
                return;
            }
            if (state.compareAndSet(current, Snapshot.closed(0))) {
                if (probe) {
                    log.info("circuit.closed breaker={}", name);
                }
                return;
            }
        }
    }

    private void onFailure(boolean probe) {
        while (true) {
            Snapshot current = state.get();
            Snapshot next;
            if (probe) {
                if (current.state() != State.HALF_OPEN) {
                    return;
                }
                next = new Snapshot(State.OPEN, current.consecutiveFailures() + 1, clock.millis());
            } else {
                if (current.state() != State.CLOSED) {
                    return;
                }
                int failures = current.consecutiveFailures() + 1;
                next = failures >= failureThreshold
                        ? new Snapshot(State.OPEN, failures, clock.millis())
                        : Snapshot.closed(failures);
            }
            if (state.compareAndSet(current, next)) {
                if (next.state() == State.OPEN) {
                    log.error("circuit.open breaker={} consecutiveFailures={} resetMs={}",
                            name, next.consecutiveFailures(), resetTimeout.toMillis());
                }
                return;
            }
        }
    }

    private void onRelease(boolean probe) {
        if (!probe) {
            return;
        }
        Snapshot current = state.get();
        if (current.state() == State.HALF_OPEN) {
            // keep the original open time so the next caller may probe straight away
            Snapshot reopened = new Snapshot(State.OPEN, current.consecutiveFailures(), current.openedAtMs());
            if (state.compareAndSet(current, reopened)) {
                log.warn("circuit.probe-abandoned breaker={}", name);
            }
        }
    }

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    public final class Permit {
        private final boolean probe;
        private final AtomicBoolean settled = new AtomicBoolean();

        private Permit(boolean probe) {
            this.probe = probe;
        }

        public boolean probe() {
            return probe;
        }

        public void success() {
            if (settled.compareAndSet(false, true)) {
                onSuccess(probe);
            }
        }

        public void failure() {
            if (settled.compareAndSet(false, true)) {
                onFailure(probe);
            }
        }

        public void release() {
            if (settled.compareAndSet(false, true)) {
                onRelease(probe);
            }
        }
    }

    private record Snapshot(State state, int consecutiveFailures, long openedAtMs) {
        static Snapshot closed(int failures) {
            return new Snapshot(State.CLOSED, failures, 0L);
        }
    }
}
