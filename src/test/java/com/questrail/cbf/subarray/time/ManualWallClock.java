package com.questrail.cbf.subarray.time;

import com.questrail.cbf.subarray.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wall clock for tests; moves only when told to.
 */
public final class ManualWallClock implements WallClock {

    private final AtomicReference<Instant> now;

    public ManualWallClock(Instant start) {
        this.now = new AtomicReference<>(start);
    }

    @Override
    public Instant now() {
        return now.get();
    }

    public void advance(Duration delta) {
        now.updateAndGet(t -> t.plus(delta));
    }
}
