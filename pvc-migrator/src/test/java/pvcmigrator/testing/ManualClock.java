package pvcmigrator.testing;

import pvcmigrator.poll.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that only moves when told to. {@link #sleeper()} advances it instead of blocking.
 */
public final class ManualClock extends Clock {

    private Instant now;
    private int sleeps;

    public ManualClock() {
        this(Instant.parse("2024-01-01T12:00:00Z"));
    }

    public ManualClock(Instant start) {
        this.now = start;
    }

    public void advance(Duration d) {
        now = now.plus(d);
    }

    public Sleeper sleeper() {
        return d -> {
            sleeps++;
            advance(d);
        };
    }

    public int sleeps() {
        return sleeps;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now;
    }
}
