package com.employeedb.database;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide result of the startup readiness loop.
 *
 * Informational only: /health always checks the database live and never reads
 * this flag.
 */
@Component
public class DatabaseStatus {

    private final AtomicBoolean ready = new AtomicBoolean(false);

    public boolean isReady() {
        return ready.get();
    }

    void markReady() {
        ready.set(true);
    }

    void markNotReady() {
        ready.set(false);
    }
}
