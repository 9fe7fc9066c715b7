package com.employeedb.aspect;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Timing and tracing for the web, service and repository layers.
 *
 * - Controllers: one INFO line on entry and one on exit/failure
 * - Services: DEBUG with arguments, WARN when slower than 1s
 * - Repositories: DEBUG only, WARN when slower than 500 ms
 *
 * Request correlation comes from the MDC set by MdcLoggingFilter.
 */
@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);

    private static final long SLOW_SERVICE_MS = 1000;
    private static final long SLOW_QUERY_MS   = 500;

    @Around("execution(* com.employeedb.controller..*(..))")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        String target = describe(joinPoint);
        log.info("→ HTTP REQUEST: {}", target);

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            log.info("← HTTP RESPONSE: {} completed in {} ms", target, System.currentTimeMillis() - startTime);
            return result;
        } catch (Exception e) {
            log.warn("← HTTP ERROR: {} failed after {} ms - {}: {}",
                     target, System.currentTimeMillis() - startTime,
                     e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    @Around("execution(* com.employeedb.service..*(..))")
    public Object logServiceMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        String target = describe(joinPoint);
        if (log.isDebugEnabled()) {
            log.debug("SERVICE CALL: {}({})", target, formatArgs(joinPoint.getArgs()));
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            if (log.isDebugEnabled()) {
                log.debug("SERVICE RETURN: {} -> {} in {} ms", target, formatParameter(result), executionTime);
            }
            if (executionTime > SLOW_SERVICE_MS) {
                log.warn("⚠ SLOW OPERATION: {} took {} ms", target, executionTime);
            }
            return result;
        } catch (Exception e) {
            log.debug("SERVICE ERROR: {} - {}: {}", target, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    @Around("execution(* com.employeedb.repository..*(..))")
    public Object logRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        String target = describe(joinPoint);
        if (log.isDebugEnabled()) {
            log.debug("DB CALL: {}({})", target, formatArgs(joinPoint.getArgs()));
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            if (executionTime > SLOW_QUERY_MS) {
                log.warn("⚠ SLOW QUERY: {} took {} ms", target, executionTime);
            }
            return result;
        } catch (Exception e) {
            log.error("DB ERROR: {} - {}: {}", target, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    private String describe(ProceedingJoinPoint joinPoint) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        return signature.getDeclaringType().getSimpleName() + "." + signature.getName();
    }

    private String formatArgs(Object[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        return Arrays.stream(args)
                .map(this::formatParameter)
                .collect(Collectors.joining(", "));
    }

    /**
     * Truncates long values so a single log line stays readable.
     */
    private String formatParameter(Object param) {
        if (param == null) {
            return "null";
        }
        String value = param.toString();
        if (value.length() > 100) {
            return value.substring(0, 97) + "...";
        }
        return value;
    }
}
