package com.unconference.backend.modules.schedule.application;

public interface ScheduleFailure {

    ScheduleErrorKind getKind();

    String getCode();
}
