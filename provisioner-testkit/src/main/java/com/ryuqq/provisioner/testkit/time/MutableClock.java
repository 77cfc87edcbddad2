package com.ryuqq.provisioner.testkit.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock that only moves when a test moves it.
 *
 * <p>Drives time-based behavior (breaker reset windows, polling deadlines) without sleeping.
 * Safe to advance from one thread while other threads read it.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = new AtomicReference<>(start);
        this.zone = zone;
    }

    /**
     * Starts at 2024-01-01T00:00:00Z.
     */
    public static MutableClock startingAtEpochOfTests() {
        return new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative");
        }
        now.updateAndGet(current -> current.plus(duration));
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now.get(), zone);
    }

    @Override
    public Instant instant() {
        return now.get();
    }
}
