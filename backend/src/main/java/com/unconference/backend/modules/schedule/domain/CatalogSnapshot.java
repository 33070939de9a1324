package com.unconference.backend.modules.schedule.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable view of the rooms and timeslots the schedule is laid out on.
 * Rooms are kept in id order, timeslots in start-time order (id breaks ties).
 */
public final class CatalogSnapshot {

    private static final Comparator<TimeslotSnapshot> TIMESLOT_ORDER = Comparator
            .comparing(TimeslotSnapshot::startsAt)
            .thenComparing(TimeslotSnapshot::id, IdOrder.ASCENDING);

    private static final CatalogSnapshot EMPTY = new CatalogSnapshot(List.of(), List.of());

    private final Map<UUID, RoomSnapshot> rooms;
    private final Map<UUID, TimeslotSnapshot> timeslots;
    private final Map<UUID, Integer> timeslotRank;

    private CatalogSnapshot(Collection<RoomSnapshot> rooms, Collection<TimeslotSnapshot> timeslots) {
        Map<UUID, RoomSnapshot> roomMap = new LinkedHashMap<>();
        rooms.stream()
                .sorted(Comparator.comparing(RoomSnapshot::id, IdOrder.ASCENDING))
                .forEach(room -> {
                    if (roomMap.put(room.id(), room) != null) {
                        throw new IllegalArgumentException("Duplicate room " + room.id());
                    }
                });
        Map<UUID, TimeslotSnapshot> timeslotMap = new LinkedHashMap<>();
        Map<UUID, Integer> rank = new LinkedHashMap<>();
        timeslots.stream()
                .sorted(TIMESLOT_ORDER)
                .forEach(timeslot -> {
                    if (timeslotMap.put(timeslot.id(), timeslot) != null) {
                        throw new IllegalArgumentException("Duplicate timeslot " + timeslot.id());
                    }
                    rank.put(timeslot.id(), rank.size());
                });
        this.rooms = Collections.unmodifiableMap(roomMap);
        this.timeslots = Collections.unmodifiableMap(timeslotMap);
        this.timeslotRank = Collections.unmodifiableMap(rank);
    }

    public static CatalogSnapshot of(Collection<RoomSnapshot> rooms, Collection<TimeslotSnapshot> timeslots) {
        return new CatalogSnapshot(rooms, timeslots);
    }

    public static CatalogSnapshot empty() {
        return EMPTY;
    }

    public List<RoomSnapshot> rooms() {
        return List.copyOf(rooms.values());
    }

    public List<TimeslotSnapshot> timeslots() {
        return List.copyOf(timeslots.values());
    }

    public Optional<TimeslotSnapshot> timeslot(UUID timeslotId) {
        return Optional.ofNullable(timeslots.get(timeslotId));
    }

    public boolean containsRoom(UUID roomId) {
        return rooms.containsKey(roomId);
    }

    public boolean containsTimeslot(UUID timeslotId) {
        return timeslots.containsKey(timeslotId);
    }

    public boolean contains(Slot slot) {
        return containsRoom(slot.roomId()) && containsTimeslot(slot.timeslotId());
    }

    /**
     * Every (room, non-blocked timeslot) pair, ordered by timeslot start and then room id.
     */
    public List<Slot> eligibleSlots() {
        List<Slot> slots = new ArrayList<>();
        for (TimeslotSnapshot timeslot : timeslots.values()) {
            if (timeslot.isBlocked()) {
                continue;
            }
            for (UUID roomId : rooms.keySet()) {
                slots.add(new Slot(roomId, timeslot.id()));
            }
        }
        return slots;
    }

    /**
     * Ordering used for every slot listing the schedule produces. Slots outside the catalog sort last.
     */
    public Comparator<Slot> slotOrder() {
        return Comparator
                .comparingInt((Slot slot) -> timeslotRank.getOrDefault(slot.timeslotId(), Integer.MAX_VALUE))
                .thenComparing(Slot::timeslotId, IdOrder.ASCENDING)
                .thenComparing(Slot::roomId, IdOrder.ASCENDING);
    }

    public CatalogSnapshot withRoom(RoomSnapshot room) {
        List<RoomSnapshot> next = new ArrayList<>(rooms.values());
        next.add(room);
        return new CatalogSnapshot(next, timeslots.values());
    }

    public CatalogSnapshot withoutRooms(Set<UUID> roomIds) {
        if (roomIds.isEmpty()) {
            return this;
        }
        List<RoomSnapshot> next = rooms.values().stream()
                .filter(room -> !roomIds.contains(room.id()))
                .toList();
        return new CatalogSnapshot(next, timeslots.values());
    }

    public CatalogSnapshot withTimeslot(TimeslotSnapshot timeslot) {
        List<TimeslotSnapshot> next = new ArrayList<>(timeslots.values());
        next.add(timeslot);
        return new CatalogSnapshot(rooms.values(), next);
    }

    public CatalogSnapshot withoutTimeslots(Set<UUID> timeslotIds) {
        if (timeslotIds.isEmpty()) {
            return this;
        }
        List<TimeslotSnapshot> next = timeslots.values().stream()
                .filter(timeslot -> !timeslotIds.contains(timeslot.id()))
                .toList();
        return new CatalogSnapshot(rooms.values(), next);
    }
}
