package com.unconference.backend.modules.schedule.infrastructure.persistence;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.unconference.backend.modules.catalog.infrastructure.persistence.SessionRepository;
import com.unconference.backend.modules.schedule.application.SessionDirectory;
import com.unconference.backend.modules.schedule.domain.SessionSnapshot;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class JpaSessionDirectory implements SessionDirectory {

    private final SessionRepository sessionRepository;

    public JpaSessionDirectory(SessionRepository sessionRepository) {
        this.sessionRepository = sessionRepository;
    }

    @Override
    public List<SessionSnapshot> findAll() {
        return sessionRepository.findAll().stream()
                .map(session -> new SessionSnapshot(
                        session.getId(),
                        session.getTitle(),
                        session.getVoteCount(),
                        session.getTag(),
                        session.getOwnerId()))
                .toList();
    }

    @Override
    public Set<UUID> findAllIds() {
        return new HashSet<>(sessionRepository.findAllIds());
    }

    @Override
    public Set<UUID> findExistingIds(Collection<UUID> sessionIds) {
        if (sessionIds.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(sessionRepository.findExistingIds(sessionIds));
    }
}
