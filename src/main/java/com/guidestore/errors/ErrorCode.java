package com.guidestore.errors;

/**
 * Stable, machine-readable error codes returned to callers.
 */
public enum ErrorCode {
    INVALID_PATH(ErrorCategory.ADDRESSING, 400),
    NAMESPACE_VIOLATION(ErrorCategory.ADDRESSING, 400),
    MISSING_PARAMETER(ErrorCategory.ADDRESSING, 400),
    INVALID_PARAMETER(ErrorCategory.ADDRESSING, 400),
    SECTION_NOT_FOUND(ErrorCategory.ADDRESSING, 404),
    DUPLICATE_HEADING(ErrorCategory.ADDRESSING, 409),
    BATCH_TOO_LARGE(ErrorCategory.ADDRESSING, 400),
    ALREADY_EXISTS(ErrorCategory.ADDRESSING, 409),

    DOCUMENT_NOT_FOUND(ErrorCategory.NOT_FOUND, 404),

    CONFLICT(ErrorCategory.CONFLICT, 409),

    TASK_NOT_FOUND(ErrorCategory.TASK_STATE, 404),
    NO_AVAILABLE_TASKS(ErrorCategory.TASK_STATE, 409),
    NO_TASKS_SECTION(ErrorCategory.TASK_STATE, 404),
    INVALID_TRANSITION(ErrorCategory.TASK_STATE, 409),

    ARCHIVE_IO(ErrorCategory.ARCHIVE_IO, 500),

    INTERNAL(ErrorCategory.INTERNAL, 500);

    private final ErrorCategory category;
    private final int httpStatus;

    ErrorCode(ErrorCategory category, int httpStatus) {
        this.category = category;
        this.httpStatus = httpStatus;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
