package com.statecore.engine.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock whose time only moves when a test advances it.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2026-03-01T10:00:00Z"));
 * ConcurrencyController controller = new ConcurrencyController(locks, time, ...);
 *
 * time.advance(Duration.ofSeconds(31));  // every 30s lease is now expired
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;

    public TimeController(Instant startTime) {
        this.currentTime = new AtomicReference<>(startTime);
    }

    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }

    public static TimeController frozen() {
        return new TimeController(Instant.parse("2026-03-01T10:00:00Z"));
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    /**
     * Move time backwards, as a stepped system clock would.
     */
    public void rewind(Duration duration) {
        currentTime.updateAndGet(t -> t.minus(duration));
    }

    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }
}
