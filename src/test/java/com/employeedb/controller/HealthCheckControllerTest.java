package com.employeedb.controller;

import com.employeedb.database.DatabaseConnectionManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest({HealthCheckController.class, RootController.class})
class HealthCheckControllerTest {

    @Autowired MockMvc mockMvc;

    @MockBean DatabaseConnectionManager connectionManager;

    @Test @DisplayName("GET /health with database up → 200 ok/ok")
    void healthy() throws Exception {
        when(connectionManager.ping()).thenReturn(true);

        mockMvc.perform(get("/health"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.status").value("ok"))
               .andExpect(jsonPath("$.db").value("ok"));
    }

    @Test @DisplayName("GET /health with database down → 503 ok/down")
    void databaseDown() throws Exception {
        when(connectionManager.ping()).thenReturn(false);

        mockMvc.perform(get("/health"))
               .andExpect(status().isServiceUnavailable())
               .andExpect(jsonPath("$.status").value("ok"))
               .andExpect(jsonPath("$.db").value("down"));
    }

    @Test @DisplayName("GET /health pings on every call")
    void pingsEveryCall() throws Exception {
        when(connectionManager.ping()).thenReturn(true, false);

        mockMvc.perform(get("/health")).andExpect(status().isOk());
        mockMvc.perform(get("/health")).andExpect(status().isServiceUnavailable());

        verify(connectionManager, times(2)).ping();
    }

    @Test @DisplayName("GET / → static message, no database access")
    void root() throws Exception {
        mockMvc.perform(get("/"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.message").value(RootController.MESSAGE));

        verifyNoInteractions(connectionManager);
    }

    @Test @DisplayName("incoming X-Request-Id is echoed back")
    void requestIdEchoed() throws Exception {
        mockMvc.perform(get("/").header("X-Request-Id", "trace-123"))
               .andExpect(header().string("X-Request-Id", "trace-123"));
    }
}
