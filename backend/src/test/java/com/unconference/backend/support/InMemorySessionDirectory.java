package com.unconference.backend.support;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.unconference.backend.modules.schedule.application.SessionDirectory;
import com.unconference.backend.modules.schedule.domain.SessionSnapshot;

public class InMemorySessionDirectory implements SessionDirectory {

    private final Map<UUID, SessionSnapshot> sessions = new ConcurrentHashMap<>();

    public InMemorySessionDirectory(Collection<SessionSnapshot> sessions) {
        sessions.forEach(this::put);
    }

    public void put(SessionSnapshot session) {
        sessions.put(session.id(), session);
    }

    public void delete(UUID sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public List<SessionSnapshot> findAll() {
        return List.copyOf(sessions.values());
    }

    @Override
    public Set<UUID> findAllIds() {
        return Set.copyOf(sessions.keySet());
    }

    @Override
    public Set<UUID> findExistingIds(Collection<UUID> sessionIds) {
        return sessionIds.stream().filter(sessions::containsKey).collect(Collectors.toSet());
    }
}
