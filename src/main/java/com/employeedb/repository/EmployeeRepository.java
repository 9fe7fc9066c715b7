package com.employeedb.repository;

import com.employeedb.domain.Employee;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for Employee entity.
 *
 * Only the inherited save() and findById() are used. No @Transactional here
 * (managed by the service layer).
 */
@Repository
public interface EmployeeRepository extends JpaRepository<Employee, Integer> {
}
