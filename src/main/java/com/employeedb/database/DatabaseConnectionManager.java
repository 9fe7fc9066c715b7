package com.employeedb.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

/**
 * Entry point to the pooled database connection.
 *
 * The pool is the auto-configured HikariCP DataSource (5 idle connections, up to
 * 15 in total). Hikari validates a connection that has been idle before handing it
 * out and silently replaces dead ones, so callers never see a stale connection.
 *
 * Request-scoped sessions are not opened here: service methods marked
 * {@code @Transactional} borrow a connection on entry and return it on every exit
 * path, committing on success and rolling back on failure.
 */
@Component
public class DatabaseConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConnectionManager.class);

    static final String LIVENESS_QUERY = "SELECT 1";

    private final JdbcTemplate              jdbcTemplate;
    private final ResourceDatabasePopulator schemaPopulator;

    public DatabaseConnectionManager(JdbcTemplate              jdbcTemplate,
                                     ResourceDatabasePopulator schemaPopulator) {
        this.jdbcTemplate    = jdbcTemplate;
        this.schemaPopulator = schemaPopulator;
    }

    /**
     * Creates the tables and indexes that are missing. Existing tables and their
     * rows are left untouched.
     *
     * @throws DataAccessException if the database cannot be reached or the script fails
     */
    public void ensureSchema() {
        jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
            schemaPopulator.populate(connection);
            return null;
        });
    }

    /**
     * Runs the liveness query once.
     *
     * @throws DataAccessException if the database cannot be reached
     */
    public void verifyConnection() {
        jdbcTemplate.queryForObject(LIVENESS_QUERY, Integer.class);
    }

    /**
     * Single liveness round-trip.
     *
     * @return true if {@code SELECT 1} succeeded, false on any error
     */
    public boolean ping() {
        try {
            verifyConnection();
            return true;
        } catch (DataAccessException ex) {
            log.warn("Database ping failed: {}", ex.getMostSpecificCause().getMessage());
            return false;
        } catch (RuntimeException ex) {
            log.warn("Database ping failed unexpectedly: {}", ex.toString());
            return false;
        }
    }
}
