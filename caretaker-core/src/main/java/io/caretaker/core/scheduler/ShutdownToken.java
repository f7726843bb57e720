package io.caretaker.core.scheduler;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot cancellation flag shared between the scheduler loop and whoever may ask it to stop.
 */
public final class ShutdownToken {
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final CountDownLatch requested = new CountDownLatch(1);

    /**
     * @return {@code true} only for the call that actually flipped the flag
     */
    public boolean request(String why) {
        if (reason.compareAndSet(null, why == null || why.isBlank() ? "unspecified" : why)) {
            requested.countDown();
            return true;
        }
        return false;
    }

    public boolean isRequested() {
        return reason.get() != null;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * Waits up to {@code timeout}, returning early once shutdown is requested.
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return requested.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
