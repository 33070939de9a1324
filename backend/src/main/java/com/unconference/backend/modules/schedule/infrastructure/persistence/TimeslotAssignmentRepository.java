package com.unconference.backend.modules.schedule.infrastructure.persistence;

import java.util.UUID;

import com.unconference.backend.modules.schedule.domain.TimeslotAssignment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeslotAssignmentRepository extends JpaRepository<TimeslotAssignment, UUID> {

    @Modifying(flushAutomatically = true)
    @Query("""
            delete from TimeslotAssignment ta
             where ta.roomId = :roomId
               and ta.timeslotId = :timeslotId
               and ta.sessionId = :sessionId
            """)
    int deleteEntry(
            @Param("roomId") UUID roomId,
            @Param("timeslotId") UUID timeslotId,
            @Param("sessionId") UUID sessionId
    );
}
