package com.unconference.backend.modules.schedule.application;

import com.unconference.backend.modules.schedule.domain.ScheduleState;
import com.unconference.backend.modules.schedule.domain.ScheduleTransition;

/**
 * Published state after a mutation together with the transition that produced it. A no-op mutation
 * carries an empty transition and the unchanged state.
 */
public record ScheduleCommit(ScheduleState state, ScheduleTransition transition) {
}
