package com.employeedb.exception;

import java.util.NoSuchElementException;

/**
 * Thrown when no employee exists for a requested id. Mapped to 404.
 */
public class EmployeeNotFoundException extends NoSuchElementException {

    public static final String MESSAGE = "Employee not found";

    private final Integer employeeId;

    public EmployeeNotFoundException(Integer employeeId) {
        super(MESSAGE);
        this.employeeId = employeeId;
    }

    public Integer getEmployeeId() {
        return employeeId;
    }
}
