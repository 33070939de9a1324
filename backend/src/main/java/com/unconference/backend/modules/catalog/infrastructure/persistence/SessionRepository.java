package com.unconference.backend.modules.catalog.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.unconference.backend.modules.catalog.domain.Session;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SessionRepository extends JpaRepository<Session, UUID> {

    @Query("select s.id from Session s")
    List<UUID> findAllIds();

    @Query("select s.id from Session s where s.id in :ids")
    List<UUID> findExistingIds(@Param("ids") Collection<UUID> ids);
}
