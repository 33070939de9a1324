package com.unconference.backend.modules.schedule.presentation;

import java.util.List;
import java.util.UUID;

import com.unconference.backend.global.security.SecurityUtils;
import com.unconference.backend.modules.schedule.application.ScheduleMutationService;
import com.unconference.backend.modules.schedule.application.ScheduleReadService;
import com.unconference.backend.modules.schedule.presentation.dto.CreateRoomRequest;
import com.unconference.backend.modules.schedule.presentation.dto.CreateTimeslotRequest;
import com.unconference.backend.modules.schedule.presentation.dto.RoomResponse;
import com.unconference.backend.modules.schedule.presentation.dto.TimeslotResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Room and timeslot management. Removals cascade into the schedule in the same transaction.
 */
@RestController
@RequestMapping("/schedule")
public class ScheduleCatalogController {

    private final ScheduleReadService scheduleReadService;
    private final ScheduleMutationService scheduleMutationService;

    public ScheduleCatalogController(ScheduleReadService scheduleReadService, ScheduleMutationService scheduleMutationService) {
        this.scheduleReadService = scheduleReadService;
        this.scheduleMutationService = scheduleMutationService;
    }

    @GetMapping("/rooms")
    public ResponseEntity<List<RoomResponse>> listRooms() {
        return ResponseEntity.ok(scheduleReadService.listRooms());
    }

    @Operation(summary = "Add a room")
    @PostMapping("/rooms")
    public ResponseEntity<RoomResponse> addRoom(@Valid @RequestBody CreateRoomRequest request) {
        RoomResponse response = scheduleMutationService.addRoom(SecurityUtils.getCurrentRole(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Remove a room", description = "Sessions assigned to the room become unassigned.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Room removed"),
            @ApiResponse(responseCode = "404", description = "Room not found")
    })
    @DeleteMapping("/rooms/{roomId}")
    public ResponseEntity<Void> removeRoom(@PathVariable UUID roomId) {
        scheduleMutationService.removeRoom(SecurityUtils.getCurrentRole(), roomId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/timeslots")
    public ResponseEntity<List<TimeslotResponse>> listTimeslots() {
        return ResponseEntity.ok(scheduleReadService.listTimeslots());
    }

    @Operation(summary = "Add a timeslot", description = "A blocked timeslot needs a reason and never receives sessions.")
    @PostMapping("/timeslots")
    public ResponseEntity<TimeslotResponse> addTimeslot(@Valid @RequestBody CreateTimeslotRequest request) {
        TimeslotResponse response = scheduleMutationService.addTimeslot(SecurityUtils.getCurrentRole(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Remove a timeslot", description = "Sessions assigned to the timeslot become unassigned.")
    @DeleteMapping("/timeslots/{timeslotId}")
    public ResponseEntity<Void> removeTimeslot(@PathVariable UUID timeslotId) {
        scheduleMutationService.removeTimeslot(SecurityUtils.getCurrentRole(), timeslotId);
        return ResponseEntity.noContent().build();
    }
}
