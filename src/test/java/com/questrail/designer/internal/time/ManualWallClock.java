package com.questrail.designer.internal.time;

import java.time.Duration;
import java.time.Instant;

/**
 * Test {@link WallClock} that only moves when told to.
 */
public final class ManualWallClock implements WallClock
{
    private Instant now;

    public ManualWallClock(Instant start) {
        this.now = start;
    }

    @Override
    public Instant now() {
        return now;
    }

    public void advance(Duration d) {
        now = now.plus(d);
    }
}
