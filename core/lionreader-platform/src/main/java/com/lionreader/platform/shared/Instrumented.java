package com.lionreader.platform.shared;

import jakarta.enterprise.util.Nonbinding;
import jakarta.interceptor.InterceptorBinding;
import java.lang.annotation.*;

/**
 * Marks a repository class for Micrometer instrumentation.
 *
 * <pre>
 * {@code @Instrumented(table = "oauth_refresh_tokens")}
 * class PanacheRefreshTokenRepository implements RefreshTokenRepository { ... }
 * </pre>
 *
 * Metrics produced:
 * - lionreader_db_operation_duration_seconds
 * - lionreader_db_operations_total, tagged with result success, unchanged or error
 * - lionreader_db_operation_errors_total
 */
@Inherited
@InterceptorBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface Instrumented {

    /**
     * Table tag for the metrics. Derived from the class name when empty.
     */
    @Nonbinding
    String table() default "";
}
