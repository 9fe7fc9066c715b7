package com.employeedb.database;

import java.time.Duration;

/**
 * Blocks the calling thread between startup attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
