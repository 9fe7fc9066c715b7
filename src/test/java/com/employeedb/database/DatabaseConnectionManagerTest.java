package com.employeedb.database;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.sql.Connection;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DatabaseConnectionManagerTest {

    @Mock JdbcTemplate              jdbcTemplate;
    @Mock ResourceDatabasePopulator schemaPopulator;
    @Mock Connection                connection;

    @Captor ArgumentCaptor<ConnectionCallback<Void>> callbackCaptor;

    @InjectMocks DatabaseConnectionManager manager;

    @Test @DisplayName("ping → true when SELECT 1 answers")
    void pingUp() {
        when(jdbcTemplate.queryForObject(DatabaseConnectionManager.LIVENESS_QUERY, Integer.class)).thenReturn(1);

        assertThat(manager.ping()).isTrue();
    }

    @Test @DisplayName("ping → false instead of throwing when the database is down")
    void pingDown() {
        when(jdbcTemplate.queryForObject(DatabaseConnectionManager.LIVENESS_QUERY, Integer.class))
            .thenThrow(new CannotGetJdbcConnectionException("Connection refused"));

        assertThat(manager.ping()).isFalse();
    }

    @Test @DisplayName("ping → false on a non-database runtime failure too")
    void pingUnexpectedFailure() {
        when(jdbcTemplate.queryForObject(DatabaseConnectionManager.LIVENESS_QUERY, Integer.class))
            .thenThrow(new IllegalStateException("pool shut down"));

        assertThat(manager.ping()).isFalse();
    }

    @Test @DisplayName("verifyConnection propagates the failure")
    void verifyConnectionPropagates() {
        when(jdbcTemplate.queryForObject(DatabaseConnectionManager.LIVENESS_QUERY, Integer.class))
            .thenThrow(new CannotGetJdbcConnectionException("Connection refused"));

        assertThatThrownBy(() -> manager.verifyConnection())
            .isInstanceOf(CannotGetJdbcConnectionException.class);
    }

    @Test @DisplayName("ensureSchema runs the schema script on a pooled connection")
    void ensureSchemaPopulates() throws Exception {
        manager.ensureSchema();

        verify(jdbcTemplate).execute(callbackCaptor.capture());
        callbackCaptor.getValue().doInConnection(connection);
        verify(schemaPopulator).populate(connection);
    }
}
