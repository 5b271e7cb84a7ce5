package com.di.qualitygate.connection;

import java.time.Duration;

/**
 * Waits between connection attempts. Replaced in tests to keep backoff instant and observable.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
