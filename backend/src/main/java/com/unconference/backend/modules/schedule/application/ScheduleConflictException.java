package com.unconference.backend.modules.schedule.application;

import com.unconference.backend.global.error.RetryableProblemException;

/**
 * The request raced another writer or was based on an outdated view; refreshing and retrying may succeed.
 */
public class ScheduleConflictException extends RetryableProblemException implements ScheduleFailure {

    public ScheduleConflictException(String code, String detail) {
        super(ScheduleErrorKind.CONFLICT.status(), code, detail, 0);
    }

    @Override
    public ScheduleErrorKind getKind() {
        return ScheduleErrorKind.CONFLICT;
    }
}
