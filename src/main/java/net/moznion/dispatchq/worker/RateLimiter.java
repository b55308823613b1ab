package net.moznion.dispatchq.worker;

import java.time.Clock;

/**
 * Fixed-window limiter shared by the slots of one pool.
 */
class RateLimiter {
    private final int max;
    private final long windowMillis;
    private final Clock clock;

    // guarded by this
    private long windowStartedAt;
    private int used;

    RateLimiter(final int max, final long windowMillis, final Clock clock) {
        this.max = max;
        this.windowMillis = windowMillis;
        this.clock = clock;
        windowStartedAt = clock.millis();
        used = 0;
    }

    synchronized boolean tryAcquire() {
        roll();
        if (used >= max) {
            return false;
        }
        used++;
        return true;
    }

    /**
     * Gives back a permit taken for a claim that found nothing.
     */
    synchronized void refund() {
        if (used > 0) {
            used--;
        }
    }

    synchronized long millisUntilNextWindow() {
        roll();
        return Math.max(0, windowStartedAt + windowMillis - clock.millis());
    }

    private void roll() {
        final long now = clock.millis();
        if (now - windowStartedAt >= windowMillis) {
            windowStartedAt = now;
            used = 0;
        }
    }
}
