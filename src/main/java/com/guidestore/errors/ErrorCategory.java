package com.guidestore.errors;

/**
 * Coarse grouping of error codes. Determines the HTTP status family and the
 * exception subclass that carries the code.
 */
public enum ErrorCategory {
    ADDRESSING,
    NOT_FOUND,
    CONFLICT,
    TASK_STATE,
    ARCHIVE_IO,
    INTERNAL
}
