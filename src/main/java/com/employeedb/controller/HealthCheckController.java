package com.employeedb.controller;

import com.employeedb.database.DatabaseConnectionManager;
import com.employeedb.dto.ApiResponses;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health check reflecting live database reachability.
 *
 * Pings the database on every call (one attempt, no retry). The outer status is
 * always "ok" because the process answered; a failed ping turns the response
 * into 503 with db "down".
 */
@RestController
@RequestMapping("/health")
@Tag(name = "health", description = "Process and database health")
public class HealthCheckController {

    private final DatabaseConnectionManager connectionManager;

    public HealthCheckController(DatabaseConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @GetMapping
    @Operation(summary = "Health check", description = "Runs SELECT 1 against the database")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Database reachable"),
        @ApiResponse(responseCode = "503", description = "Database unreachable")
    })
    public ResponseEntity<ApiResponses.HealthResponse> healthCheck() {
        boolean databaseUp = connectionManager.ping();
        return ResponseEntity
                .status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiResponses.HealthResponse(databaseUp));
    }

}
