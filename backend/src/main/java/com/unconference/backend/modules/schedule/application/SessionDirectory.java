package com.unconference.backend.modules.schedule.application;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.unconference.backend.modules.schedule.domain.SessionSnapshot;

/**
 * Read access to the session/vote store.
 */
public interface SessionDirectory {

    List<SessionSnapshot> findAll();

    Set<UUID> findAllIds();

    Set<UUID> findExistingIds(Collection<UUID> sessionIds);
}
