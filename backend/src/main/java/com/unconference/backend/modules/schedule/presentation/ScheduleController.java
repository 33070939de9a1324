package com.unconference.backend.modules.schedule.presentation;

import java.util.UUID;

import com.unconference.backend.global.security.SecurityUtils;
import com.unconference.backend.modules.schedule.application.ScheduleMutationService;
import com.unconference.backend.modules.schedule.application.ScheduleReadService;
import com.unconference.backend.modules.schedule.domain.Slot;
import com.unconference.backend.modules.schedule.presentation.dto.AssignSessionRequest;
import com.unconference.backend.modules.schedule.presentation.dto.MoveSessionRequest;
import com.unconference.backend.modules.schedule.presentation.dto.ScheduleResponse;
import com.unconference.backend.modules.schedule.presentation.dto.SlotChangeResponse;
import com.unconference.backend.modules.schedule.presentation.dto.SwapSessionsRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/schedule")
public class ScheduleController {

    private final ScheduleReadService scheduleReadService;
    private final ScheduleMutationService scheduleMutationService;

    public ScheduleController(ScheduleReadService scheduleReadService, ScheduleMutationService scheduleMutationService) {
        this.scheduleReadService = scheduleReadService;
        this.scheduleMutationService = scheduleMutationService;
    }

    @Operation(summary = "Current schedule", description = "Rooms, timeslots, assigned entries and unassigned sessions.")
    @GetMapping
    public ResponseEntity<ScheduleResponse> getSchedule() {
        return ResponseEntity.ok(scheduleReadService.currentSchedule());
    }

    @Operation(summary = "Generate schedule", description = "Replaces the whole schedule with an optimized assignment.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Schedule generated"),
            @ApiResponse(responseCode = "403", description = "Facilitator or admin role required"),
            @ApiResponse(responseCode = "409", description = "Superseded by a newer request or catalog changed")
    })
    @PostMapping("/generate")
    public ResponseEntity<ScheduleResponse> generate() {
        return ResponseEntity.ok(scheduleMutationService.generate(SecurityUtils.getCurrentRole()));
    }

    @Operation(summary = "Clear schedule")
    @PostMapping("/clear")
    public ResponseEntity<ScheduleResponse> clear() {
        return ResponseEntity.ok(scheduleMutationService.clear(SecurityUtils.getCurrentRole()));
    }

    @Operation(summary = "Move a session", description = "Moving onto an occupied slot swaps the two sessions.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session moved"),
            @ApiResponse(responseCode = "404", description = "Slot empty or room/timeslot missing"),
            @ApiResponse(responseCode = "409", description = "Target blocked or request based on a stale schedule")
    })
    @PutMapping("/move")
    public ResponseEntity<SlotChangeResponse> move(@Valid @RequestBody MoveSessionRequest request) {
        SlotChangeResponse response = scheduleMutationService.move(
                SecurityUtils.getCurrentRole(),
                request.fromSlot().toSlot(),
                request.targetSlot(),
                request.sessionId(),
                request.expectedVersion()
        );
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Swap two sessions")
    @PutMapping("/swap")
    public ResponseEntity<SlotChangeResponse> swap(@Valid @RequestBody SwapSessionsRequest request) {
        SlotChangeResponse response = scheduleMutationService.swap(
                SecurityUtils.getCurrentRole(),
                request.slotA().toSlot(),
                request.slotB().toSlot(),
                request.sessionIdA(),
                request.sessionIdB(),
                request.expectedVersion()
        );
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Place an unscheduled session", description = "Without a slot the first free slot is used.")
    @PostMapping("/sessions")
    public ResponseEntity<SlotChangeResponse> assignSession(@Valid @RequestBody AssignSessionRequest request) {
        Slot target = request.slot() == null ? null : request.slot().toSlot();
        return ResponseEntity.ok(scheduleMutationService.assignSession(SecurityUtils.getCurrentRole(), request.sessionId(), target));
    }

    @Operation(summary = "Detach a deleted session", description = "Cascade hook called by the session store.")
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> detachSession(@PathVariable UUID sessionId) {
        scheduleMutationService.detachSession(SecurityUtils.getCurrentRole(), sessionId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Empty a slot")
    @DeleteMapping("/slots")
    public ResponseEntity<SlotChangeResponse> unassignSession(
            @RequestParam("roomId") UUID roomId,
            @RequestParam("timeslotId") UUID timeslotId,
            @RequestParam(name = "sessionId", required = false) UUID sessionId
    ) {
        SlotChangeResponse response = scheduleMutationService.unassignSession(
                SecurityUtils.getCurrentRole(), new Slot(roomId, timeslotId), sessionId);
        return ResponseEntity.ok(response);
    }
}
