package com.employeedb.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the startup readiness loop, bound from {@code employeedb.startup.*}.
 *
 * With the defaults the loop waits 2, 4, 8 and then 10 seconds between attempts.
 *
 * @param schemaLocation  idempotent DDL script applied on every attempt
 * @param maxAttempts     attempts before giving up (the process keeps running)
 * @param initialInterval wait after the first failed attempt
 * @param multiplier      growth factor between consecutive waits
 * @param maxInterval     upper bound for a single wait
 */
@Validated
@ConfigurationProperties(prefix = "employeedb.startup")
public record StartupProperties(
        @NotBlank @DefaultValue("classpath:db/schema.sql") String schemaLocation,
        @Min(1) @DefaultValue("10") int maxAttempts,
        @NotNull @DefaultValue("2s") Duration initialInterval,
        @DecimalMin("1.0") @DefaultValue("2.0") double multiplier,
        @NotNull @DefaultValue("10s") Duration maxInterval) {
}
