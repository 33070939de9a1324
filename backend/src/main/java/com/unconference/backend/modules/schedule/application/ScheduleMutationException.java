package com.unconference.backend.modules.schedule.application;

import com.unconference.backend.global.error.ProblemException;

public class ScheduleMutationException extends ProblemException implements ScheduleFailure {

    private final ScheduleErrorKind kind;

    public ScheduleMutationException(ScheduleErrorKind kind, String code, String detail) {
        super(kind.status(), code, detail);
        this.kind = kind;
    }

    @Override
    public ScheduleErrorKind getKind() {
        return kind;
    }
}
