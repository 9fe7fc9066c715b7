package com.employeedb.domain;

import jakarta.persistence.*;
import java.util.Objects;

/**
 * Employee record persisted in the {@code employees} table.
 *
 * The table is created by db/schema.sql at startup, not by Hibernate; the
 * mapping below mirrors that script.
 *
 * Design decisions:
 * - id is generated by the database and has no setter, so it never changes
 * - name is required and must contain non-whitespace text
 * - no update or delete operations exist for this entity
 */
@Entity
@Table(
    name = "employees",
    indexes = {
        @Index(name = "ix_employees_id", columnList = "id"),
        @Index(name = "ix_employees_name", columnList = "name")
    }
)
public class Employee {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(nullable = false, length = 255)
    private String name;

    /**
     * JPA requires a no-arg constructor.
     */
    protected Employee() {
    }

    /**
     * @param name display name, must not be blank
     * @throws IllegalArgumentException if name is null or blank
     */
    public Employee(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Employee name must not be blank");
        }
        this.name = name;
    }

    public Integer getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Employee employee = (Employee) o;
        return id != null && Objects.equals(id, employee.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return "Employee{" +
                "id=" + id +
                ", name='" + name + '\'' +
                '}';
    }
}
