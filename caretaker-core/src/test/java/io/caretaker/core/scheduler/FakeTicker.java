package io.caretaker.core.scheduler;

import io.caretaker.core.support.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Virtual sleep: advances the clock instead of blocking, then runs any hook registered for the
 * tick number just completed.
 */
final class FakeTicker implements Ticker {
    private final MutableClock clock;
    private final List<Runnable> afterTick = new ArrayList<>();
    private int ticks;

    FakeTicker(MutableClock clock) {
        this.clock = clock;
    }

    FakeTicker onEachTick(Runnable hook) {
        afterTick.add(hook);
        return this;
    }

    int ticks() {
        return ticks;
    }

    @Override
    public void sleep(Duration duration) {
        clock.advance(duration);
        ticks++;
        for (Runnable hook : afterTick) {
            hook.run();
        }
    }
}
