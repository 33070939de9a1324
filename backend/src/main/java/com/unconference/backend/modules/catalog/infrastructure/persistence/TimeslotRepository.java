package com.unconference.backend.modules.catalog.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.unconference.backend.modules.catalog.domain.Timeslot;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TimeslotRepository extends JpaRepository<Timeslot, UUID> {

    List<Timeslot> findAllByOrderByStartsAtAscIdAsc();
}
