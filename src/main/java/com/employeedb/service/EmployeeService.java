package com.employeedb.service;

import com.employeedb.domain.Employee;
import com.employeedb.exception.EmployeeNotFoundException;
import com.employeedb.repository.EmployeeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for employee records.
 *
 * Every public method runs in its own transaction, so each request holds one
 * pooled connection and gives it back when the method returns or throws.
 */
@Service
@Transactional
public class EmployeeService {

    private static final Logger log = LoggerFactory.getLogger(EmployeeService.class);

    private final EmployeeRepository employeeRepository;

    public EmployeeService(EmployeeRepository employeeRepository) {
        this.employeeRepository = employeeRepository;
    }

    /**
     * Insert a new employee. The id is assigned by the database.
     *
     * @param name employee name, non-blank
     * @return the persisted employee with its id
     * @throws IllegalArgumentException if name is blank
     */
    public Employee createEmployee(String name) {
        Employee employee = employeeRepository.saveAndFlush(new Employee(name));
        log.info("Employee created - id={}, name={}", employee.getId(), employee.getName());
        return employee;
    }

    /**
     * Look up an employee by primary key.
     *
     * @throws EmployeeNotFoundException if no row has this id
     */
    @Transactional(readOnly = true)
    public Employee getEmployee(Integer id) {
        return employeeRepository.findById(id)
                .orElseThrow(() -> {
                    log.debug("Employee lookup missed - id={}", id);
                    return new EmployeeNotFoundException(id);
                });
    }
}
