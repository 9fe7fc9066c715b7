package com.employeedb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the Employee DB service.
 * Exposes a health check and employee records backed by PostgreSQL.
 *
 * The web server binds immediately; the database schema is ensured afterwards
 * by {@link com.employeedb.database.DatabaseReadinessInitializer}, which retries
 * until the database is reachable.
 *
 * @author Employee DB Team
 * @version 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@ConfigurationPropertiesScan
public class EmployeeDbApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmployeeDbApplication.class, args);
    }

}
