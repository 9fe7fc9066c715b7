package com.employeedb.database;

import com.employeedb.config.StartupProperties;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Ensures the schema once at startup, retrying while the database is unreachable.
 *
 * Runs after the embedded server is already listening, so /health answers while
 * this loop is still waiting. Each attempt applies the schema script and then the
 * liveness query. A failed attempt is followed by a capped exponential wait
 * (2, 4, 8, 10, 10, ... seconds by default), including after the last one.
 *
 * Giving up is not fatal: the process stays up, {@link DatabaseStatus} stays
 * not-ready and /health keeps reporting the outage.
 */
@Component
public class DatabaseReadinessInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DatabaseReadinessInitializer.class);

    private final DatabaseConnectionManager connectionManager;
    private final DatabaseStatus            status;
    private final IntervalFunction          backoff;
    private final Sleeper                   sleeper;
    private final int                       maxAttempts;

    public DatabaseReadinessInitializer(DatabaseConnectionManager connectionManager,
                                        DatabaseStatus            status,
                                        IntervalFunction          startupBackoff,
                                        Sleeper                   sleeper,
                                        StartupProperties         properties) {
        this.connectionManager = connectionManager;
        this.status            = status;
        this.backoff           = startupBackoff;
        this.sleeper           = sleeper;
        this.maxAttempts       = properties.maxAttempts();
    }

    @Override
    public void run(ApplicationArguments args) {
        initialize();
    }

    /**
     * Runs the bounded retry loop.
     *
     * @return true if the schema was ensured and the database answered
     */
    public boolean initialize() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                connectionManager.ensureSchema();
                connectionManager.verifyConnection();
                status.markReady();
                log.info("Database connected and tables ensured (attempt {}/{})", attempt, maxAttempts);
                return true;
            } catch (DataAccessException ex) {
                status.markNotReady();
                Duration wait = Duration.ofMillis(backoff.apply(attempt));
                log.warn("Database not ready (attempt {}/{}): {}. Retrying in {} ms",
                        attempt, maxAttempts, ex.getMostSpecificCause().getMessage(), wait.toMillis());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Database readiness loop interrupted after attempt {}/{}", attempt, maxAttempts);
                    return false;
                }
            }
        }
        log.error("Could not connect to the database after {} attempts. "
                + "Service keeps running; /health will report the database as down.", maxAttempts);
        return false;
    }
}
