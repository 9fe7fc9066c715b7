package com.employeedb.controller;

import com.employeedb.domain.Employee;
import com.employeedb.dto.ApiResponses;
import com.employeedb.dto.CreateEmployeeRequest;
import com.employeedb.service.EmployeeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for employee records.
 *
 * RULES:
 * - No business logic: pure delegation to EmployeeService
 * - DTOs are mapped at controller boundary; entities never leak
 *
 * HTTP CONTRACT SUMMARY:
 * POST   /employees           → 201 | 400 invalid body | 503 database down
 * GET    /employees/{id}      → 200 | 400 bad id | 404
 */
@RestController
@RequestMapping("/employees")
@Tag(name = "employees", description = "Create and read employee records")
public class EmployeeController {

    private final EmployeeService employeeService;

    public EmployeeController(EmployeeService employeeService) {
        this.employeeService = employeeService;
    }

    @PostMapping
    @Operation(summary = "Create employee", description = "Inserts one employee; the id is assigned by the database")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Employee created"),
        @ApiResponse(responseCode = "400", description = "Name missing or blank")
    })
    public ResponseEntity<ApiResponses.EmployeeResponse> createEmployee(
            @Valid @RequestBody CreateEmployeeRequest request) {
        Employee employee = employeeService.createEmployee(request.getName());
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new ApiResponses.EmployeeResponse(employee));
    }

    @GetMapping("/{employeeId}")
    @Operation(summary = "Get employee", description = "Look up an employee by id")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Employee found"),
        @ApiResponse(responseCode = "404", description = "Employee not found")
    })
    public ResponseEntity<ApiResponses.EmployeeResponse> getEmployee(
            @Parameter(description = "Employee ID") @PathVariable @Positive Integer employeeId) {
        Employee employee = employeeService.getEmployee(employeeId);
        return ResponseEntity.ok(new ApiResponses.EmployeeResponse(employee));
    }
}
