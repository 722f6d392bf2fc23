package com.scholary.vocalization.api;

import java.time.Instant;

/**
 * Error body for every non-2xx response.
 *
 * @param status HTTP status code
 * @param error short machine-readable error name
 * @param message human-readable explanation
 * @param timestamp when the error was produced
 */
public record ApiError(int status, String error, String message, Instant timestamp) {}
