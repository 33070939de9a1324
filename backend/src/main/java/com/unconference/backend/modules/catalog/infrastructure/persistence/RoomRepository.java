package com.unconference.backend.modules.catalog.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.unconference.backend.modules.catalog.domain.Room;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoomRepository extends JpaRepository<Room, UUID> {

    List<Room> findAllByOrderByIdAsc();
}
