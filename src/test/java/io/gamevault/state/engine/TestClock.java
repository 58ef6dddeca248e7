package io.gamevault.state.engine;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

final class TestClock extends Clock {
    private final AtomicLong millis;

    TestClock(long startMs) {
        this.millis = new AtomicLong(startMs);
    }

    void set(long nowMs) {
        millis.set(nowMs);
    }

    void advance(long deltaMs) {
        millis.addAndGet(deltaMs);
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
        return Instant.ofEpochMilli(millis.get());
    }

    @Override
    public long millis() {
        return millis.get();
    }
}
