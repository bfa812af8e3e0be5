package org.crawljav;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Self-imposed rate limit: a random pause between two requests. Also the point where an interrupt
 * stops a running stage.
 */
public class Politeness {
    private final long minMillis;
    private final long maxMillis;

    public Politeness(Duration min, Duration max) {
        this.minMillis = Math.max(0, min.toMillis());
        this.maxMillis = Math.max(minMillis, max.toMillis());
    }

    public static Politeness none() {
        return new Politeness(Duration.ZERO, Duration.ZERO);
    }

    long nextDelayMillis() {
        if (maxMillis == minMillis) return minMillis;
        return ThreadLocalRandom.current().nextLong(minMillis, maxMillis + 1);
    }

    public void pause() throws InterruptedException {
        if (Thread.interrupted()) throw new InterruptedException("Interrupted between requests");
        long delay = nextDelayMillis();
        if (delay > 0) Thread.sleep(delay);
    }
}
