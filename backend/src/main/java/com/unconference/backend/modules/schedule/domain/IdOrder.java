package com.unconference.backend.modules.schedule.domain;

import java.util.Comparator;
import java.util.UUID;

/**
 * Ascending id order as PostgreSQL sorts {@code uuid} columns and as the canonical text form reads:
 * both halves compared unsigned. {@link UUID#compareTo} compares signed halves and disagrees for ids
 * with the top bit set.
 */
public final class IdOrder {

    public static final Comparator<UUID> ASCENDING = Comparator
            .comparing(UUID::getMostSignificantBits, Long::compareUnsigned)
            .thenComparing(UUID::getLeastSignificantBits, Long::compareUnsigned);

    private IdOrder() {
    }
}
