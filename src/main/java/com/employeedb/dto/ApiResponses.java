package com.employeedb.dto;

import com.employeedb.domain.Employee;

import java.time.Instant;

/**
 * Response DTOs for API endpoints.
 */
public class ApiResponses {

    /**
     * Employee response: {@code {"id": 1, "name": "Alice"}}.
     */
    public static class EmployeeResponse {
        private Integer id;
        private String name;

        public EmployeeResponse(Employee employee) {
            this.id = employee.getId();
            this.name = employee.getName();
        }

        // Getters
        public Integer getId() { return id; }
        public String getName() { return name; }
    }

    /**
     * Health response. {@code status} describes the process, {@code db} the database.
     */
    public static class HealthResponse {
        public static final String OK = "ok";
        public static final String DOWN = "down";

        private String status;
        private String db;

        public HealthResponse(boolean databaseUp) {
            this.status = OK;
            this.db = databaseUp ? OK : DOWN;
        }

        // Getters
        public String getStatus() { return status; }
        public String getDb() { return db; }
    }

    /**
     * Informational message.
     */
    public static class MessageResponse {
        private String message;

        public MessageResponse(String message) {
            this.message = message;
        }

        public String getMessage() { return message; }
    }

    /**
     * Error response.
     */
    public static class ErrorResponse {
        private String error;
        private String message;
        private Instant timestamp;

        public ErrorResponse(String error, String message) {
            this.error = error;
            this.message = message;
            this.timestamp = Instant.now();
        }

        // Getters
        public String getError() { return error; }
        public String getMessage() { return message; }
        public Instant getTimestamp() { return timestamp; }
    }
}
