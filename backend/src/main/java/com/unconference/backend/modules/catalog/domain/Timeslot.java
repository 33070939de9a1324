package com.unconference.backend.modules.catalog.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.unconference.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A block of time shared by every room. A non-null {@code blockedReason} marks it as unschedulable
 * (lunch, keynote, closing circle).
 */
@Entity
@Table(name = "timeslot")
public class Timeslot extends AbstractTimestampedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "starts_at", nullable = false)
    private OffsetDateTime startsAt;

    @Column(name = "ends_at", nullable = false)
    private OffsetDateTime endsAt;

    @Column(name = "blocked_reason", length = 255)
    private String blockedReason;

    protected Timeslot() {
    }

    public Timeslot(UUID id, OffsetDateTime startsAt, OffsetDateTime endsAt, String blockedReason) {
        this.id = id;
        this.startsAt = startsAt;
        this.endsAt = endsAt;
        this.blockedReason = blockedReason;
    }

    public UUID getId() {
        return id;
    }

    public OffsetDateTime getStartsAt() {
        return startsAt;
    }

    public OffsetDateTime getEndsAt() {
        return endsAt;
    }

    public String getBlockedReason() {
        return blockedReason;
    }

    public boolean isBlocked() {
        return blockedReason != null;
    }
}
