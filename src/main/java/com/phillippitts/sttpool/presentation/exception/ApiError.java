package com.phillippitts.sttpool.presentation.exception;

import java.time.Instant;

/**
 * Standardized error response for API clients.
 *
 * @param errorCode machine-readable code (exception simple name or outcome kind)
 * @param message   short human-readable summary
 * @param details   further detail safe to show a client
 * @param timestamp when the error was produced
 */
public record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
) {
}
