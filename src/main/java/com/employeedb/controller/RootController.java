package com.employeedb.controller;

import com.employeedb.dto.ApiResponses;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

    static final String MESSAGE = "Hello - Employee DB service is running. Check /health.";

    @GetMapping("/")
    @Operation(summary = "Service banner", description = "Static message, never touches the database")
    public ResponseEntity<ApiResponses.MessageResponse> root() {
        return ResponseEntity.ok(new ApiResponses.MessageResponse(MESSAGE));
    }
}
