package com.unconference.backend.modules.schedule.domain;

import java.util.UUID;

import com.unconference.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Persistent form of one {@link AssignmentEntry}. Uniqueness of (room, timeslot) and of the session is
 * enforced by the table constraints.
 */
@Entity
@Table(name = "timeslot_assignment")
public class TimeslotAssignment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "room_id", nullable = false, columnDefinition = "uuid")
    private UUID roomId;

    @Column(name = "timeslot_id", nullable = false, columnDefinition = "uuid")
    private UUID timeslotId;

    @Column(name = "session_id", nullable = false, columnDefinition = "uuid")
    private UUID sessionId;

    protected TimeslotAssignment() {
    }

    public TimeslotAssignment(UUID roomId, UUID timeslotId, UUID sessionId) {
        this.roomId = roomId;
        this.timeslotId = timeslotId;
        this.sessionId = sessionId;
    }

    public static TimeslotAssignment from(AssignmentEntry entry) {
        return new TimeslotAssignment(entry.slot().roomId(), entry.slot().timeslotId(), entry.sessionId());
    }

    public AssignmentEntry toEntry() {
        return AssignmentEntry.of(roomId, timeslotId, sessionId);
    }

    public UUID getId() {
        return id;
    }

    public UUID getRoomId() {
        return roomId;
    }

    public UUID getTimeslotId() {
        return timeslotId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
