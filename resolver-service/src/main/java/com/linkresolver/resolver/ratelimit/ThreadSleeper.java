package com.linkresolver.resolver.ratelimit;

import java.time.Duration;

public final class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        long ms = Math.max(0, duration.toMillis());
        if (ms > 0) {
            Thread.sleep(ms);
        }
    }
}
