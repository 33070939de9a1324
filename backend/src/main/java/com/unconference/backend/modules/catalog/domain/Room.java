package com.unconference.backend.modules.catalog.domain;

import java.util.UUID;

import com.unconference.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Venue room. Ids are assigned by the schedule store before the row is written.
 */
@Entity
@Table(name = "room")
public class Room extends AbstractTimestampedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "location", length = 255)
    private String location;

    @Column(name = "available_spots", nullable = false)
    private int availableSpots;

    protected Room() {
    }

    public Room(UUID id, String name, String location, int availableSpots) {
        this.id = id;
        this.name = name;
        this.location = location;
        this.availableSpots = availableSpots;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getLocation() {
        return location;
    }

    public int getAvailableSpots() {
        return availableSpots;
    }
}
