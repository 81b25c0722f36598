package com.lionreader.platform.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for use case failures.
 *
 * Errors are categorized by type to enable consistent HTTP status mapping.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Input validation failed (missing required fields, invalid format, etc.)
     * Maps to HTTP 400 Bad Request.
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}
}
