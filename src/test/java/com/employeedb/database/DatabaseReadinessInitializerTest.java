package com.employeedb.database;

import com.employeedb.config.StartupProperties;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Readiness loop with a recording sleeper; no real waiting.
 */
@ExtendWith(MockitoExtension.class)
class DatabaseReadinessInitializerTest {

    @Mock DatabaseConnectionManager connectionManager;

    private final List<Duration> waits  = new ArrayList<>();
    private final DatabaseStatus status = new DatabaseStatus();

    private DatabaseReadinessInitializer initializer;

    @BeforeEach
    void setUp() {
        StartupProperties properties = new StartupProperties(
                "classpath:db/schema.sql", 10, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(10));
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(
                properties.initialInterval(), properties.multiplier(), properties.maxInterval());
        initializer = new DatabaseReadinessInitializer(
                connectionManager, status, backoff, waits::add, properties);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test @DisplayName("database up → schema then ping, ready on first attempt, no wait")
    void readyFirstAttempt() {
        assertThat(initializer.initialize()).isTrue();

        InOrder order = inOrder(connectionManager);
        order.verify(connectionManager).ensureSchema();
        order.verify(connectionManager).verifyConnection();
        assertThat(status.isReady()).isTrue();
        assertThat(waits).isEmpty();
    }

    @Test @DisplayName("two failures then success → waits 2s, 4s and becomes ready")
    void recoversAfterFailures() {
        doThrow(new CannotGetJdbcConnectionException("refused"))
            .doThrow(new CannotGetJdbcConnectionException("refused"))
            .doNothing()
            .when(connectionManager).ensureSchema();

        assertThat(initializer.initialize()).isTrue();

        assertThat(waits).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
        verify(connectionManager, times(3)).ensureSchema();
        assertThat(status.isReady()).isTrue();
    }

    @Test @DisplayName("database never reachable → 10 attempts, capped waits, stays not ready")
    void givesUpAfterMaxAttempts() {
        doThrow(new CannotGetJdbcConnectionException("refused")).when(connectionManager).ensureSchema();

        assertThat(initializer.initialize()).isFalse();

        verify(connectionManager, times(10)).ensureSchema();
        verify(connectionManager, never()).verifyConnection();
        assertThat(waits).extracting(Duration::getSeconds)
            .containsExactly(2L, 4L, 8L, 10L, 10L, 10L, 10L, 10L, 10L, 10L);
        assertThat(status.isReady()).isFalse();
    }

    @Test @DisplayName("schema applied but ping fails → counted as a failed attempt")
    void pingFailureRetries() {
        doThrow(new CannotGetJdbcConnectionException("refused"))
            .doNothing()
            .when(connectionManager).verifyConnection();

        assertThat(initializer.initialize()).isTrue();

        verify(connectionManager, times(2)).ensureSchema();
        assertThat(waits).containsExactly(Duration.ofSeconds(2));
    }

    @Test @DisplayName("interrupted while waiting → stops early and keeps the interrupt flag")
    void interruptedStops() {
        doThrow(new CannotGetJdbcConnectionException("refused")).when(connectionManager).ensureSchema();
        DatabaseReadinessInitializer interrupted = new DatabaseReadinessInitializer(
                connectionManager, status, attempt -> 2000L,
                duration -> { throw new InterruptedException("shutdown"); },
                new StartupProperties("classpath:db/schema.sql", 10,
                        Duration.ofSeconds(2), 2.0, Duration.ofSeconds(10)));

        assertThat(interrupted.initialize()).isFalse();

        verify(connectionManager, times(1)).ensureSchema();
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(status.isReady()).isFalse();
    }
}
