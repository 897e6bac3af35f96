package ai.foundrystack.backend.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sliding-window-log rate limiter keyed by an arbitrary identifier.
 *
 * A request is accepted when fewer than {@code maxRequests} accepted requests fall inside the
 * window ending now. Rejected attempts are not recorded. State is per process and in memory.
 */
public class SlidingWindowRateLimiter {

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final ConcurrentHashMap<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Records the request and returns true if it fits in the window, otherwise returns false
     * without recording it.
     */
    public boolean isAllowed(String identifier) {
        Instant now = clock.instant();
        AtomicReference<Boolean> allowed = new AtomicReference<>(Boolean.FALSE);
        windows.compute(identifier, (key, timestamps) -> {
            Deque<Instant> log = timestamps != null ? timestamps : new ArrayDeque<>();
            prune(log, now);
            if (log.size() < maxRequests) {
                log.addLast(now);
                allowed.set(Boolean.TRUE);
            }
            return log;
        });
        return allowed.get();
    }

    public int remaining(String identifier) {
        return Math.max(0, maxRequests - retainedCount(identifier));
    }

    /**
     * @return when the oldest retained request leaves the window, or now if nothing is retained
     */
    public Instant resetAt(String identifier) {
        Instant now = clock.instant();
        AtomicReference<Instant> oldest = new AtomicReference<>();
        windows.computeIfPresent(identifier, (key, log) -> {
            prune(log, now);
            oldest.set(log.peekFirst());
            return log;
        });
        return oldest.get() != null ? oldest.get().plus(window) : now;
    }

    /**
     * Drops identifiers whose windows no longer hold any request.
     *
     * @return number of identifiers removed
     */
    public int sweep() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();
        for (String identifier : windows.keySet()) {
            windows.computeIfPresent(identifier, (key, log) -> {
                prune(log, now);
                if (log.isEmpty()) {
                    removed.incrementAndGet();
                    return null;
                }
                return log;
            });
        }
        return removed.get();
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    int trackedIdentifiers() {
        return windows.size();
    }

    private int retainedCount(String identifier) {
        Instant now = clock.instant();
        AtomicInteger count = new AtomicInteger();
        windows.computeIfPresent(identifier, (key, log) -> {
            prune(log, now);
            count.set(log.size());
            return log;
        });
        return count.get();
    }

    private void prune(Deque<Instant> log, Instant now) {
        Instant windowStart = now.minus(window);
        while (!log.isEmpty() && !log.peekFirst().isAfter(windowStart)) {
            log.pollFirst();
        }
    }
}
