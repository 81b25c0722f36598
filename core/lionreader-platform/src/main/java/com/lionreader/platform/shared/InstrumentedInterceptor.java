package com.lionreader.platform.shared;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.interceptor.AroundInvoke;
import jakarta.interceptor.Interceptor;
import jakarta.interceptor.InvocationContext;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Times repository calls and counts them by outcome.
 *
 * A conditional update that returns {@code false} (an already used code, a
 * revoked refresh token) is counted as {@code unchanged} rather than success,
 * so lost claim races show up in the metrics.
 */
@Instrumented
@Interceptor
@Priority(Interceptor.Priority.APPLICATION)
public class InstrumentedInterceptor {

    private static final Logger LOG = Logger.getLogger(InstrumentedInterceptor.class);
    private static final long SLOW_OPERATION_MS = 100;

    private final Map<Class<?>, String> tableNames = new ConcurrentHashMap<>();

    @Inject
    MeterRegistry registry;

    @AroundInvoke
    public Object instrument(InvocationContext ctx) throws Exception {
        String table = tableNames.computeIfAbsent(ctx.getTarget().getClass(), InstrumentedInterceptor::tableFor);
        String operation = ctx.getMethod().getName();
        Timer.Sample sample = Timer.start(registry);
        String outcome = "error";

        try {
            Object value = ctx.proceed();
            outcome = Boolean.FALSE.equals(value) ? "unchanged" : "success";
            return value;
        } catch (Exception e) {
            registry.counter("lionreader.db.operation.errors",
                "table", table, "operation", operation, "error_type", classify(e)).increment();
            throw e;
        } finally {
            long elapsedMs = sample.stop(Timer.builder("lionreader.db.operation.duration")
                .tag("table", table)
                .tag("operation", operation)
                .register(registry)) / 1_000_000;
            registry.counter("lionreader.db.operations",
                "table", table, "operation", operation, "result", outcome).increment();
            if (elapsedMs > SLOW_OPERATION_MS) {
                LOG.warnf("Slow database operation %s.%s: %dms", table, operation, elapsedMs);
            }
        }
    }

    private static String tableFor(Class<?> type) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            Instrumented annotation = c.getAnnotation(Instrumented.class);
            if (annotation != null && !annotation.table().isEmpty()) {
                return annotation.table();
            }
        }
        // PanacheRefreshTokenRepository_Subclass -> refreshtoken
        String name = type.getSimpleName();
        if (name.contains("_")) {
            name = name.substring(0, name.indexOf('_'));
        }
        return name.replace("Panache", "").replace("Repository", "").toLowerCase();
    }

    // Hibernate and JDBC exception names are stable enough to bucket on
    private static String classify(Exception e) {
        String name = e.getClass().getSimpleName();
        if (name.contains("Constraint")) {
            return "constraint_violation";
        }
        if (name.contains("Lock") || name.contains("Timeout")) {
            return "lock_conflict";
        }
        if (name.contains("Connection")) {
            return "connection";
        }
        return "internal";
    }
}
