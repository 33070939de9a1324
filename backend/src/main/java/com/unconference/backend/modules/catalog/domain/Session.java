package com.unconference.backend.modules.catalog.domain;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Talk proposal as published by the session/vote store. The schedule only ever reads these rows.
 */
@Entity
@Immutable
@Table(name = "session")
public class Session {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "body", columnDefinition = "text")
    private String body;

    @Column(name = "vote_count", nullable = false)
    private int voteCount;

    @Column(name = "tag", length = 64)
    private String tag;

    @Column(name = "owner_id", columnDefinition = "uuid")
    private UUID ownerId;

    protected Session() {
    }

    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public int getVoteCount() {
        return voteCount;
    }

    public String getTag() {
        return tag;
    }

    public UUID getOwnerId() {
        return ownerId;
    }
}
