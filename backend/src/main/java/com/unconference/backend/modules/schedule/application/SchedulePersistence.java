package com.unconference.backend.modules.schedule.application;

import com.unconference.backend.modules.schedule.domain.ScheduleTransition;

/**
 * Durable side of the assignment store.
 */
public interface SchedulePersistence {

    PersistedSchedule load();

    /**
     * Writes the whole transition in one transaction. Implementations must apply removals before
     * insertions so a swap never trips the uniqueness constraints halfway.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if the database rejects the change
     */
    void commit(ScheduleTransition transition);
}
