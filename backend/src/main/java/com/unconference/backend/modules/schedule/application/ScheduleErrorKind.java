package com.unconference.backend.modules.schedule.application;

import org.springframework.http.HttpStatus;

/**
 * Failure categories a schedule mutation can end in, with the HTTP status each one is reported as.
 */
public enum ScheduleErrorKind {
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    SLOT_BLOCKED(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    INVARIANT_VIOLATION(HttpStatus.INTERNAL_SERVER_ERROR),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    ScheduleErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
