package com.unconference.backend.modules.schedule.application;

import java.util.List;

import com.unconference.backend.modules.schedule.domain.AssignmentEntry;

/**
 * @param converged false when the pass limit or the time budget stopped the search early
 */
public record OptimizationResult(
        List<AssignmentEntry> entries,
        long capturedVotes,
        long overlapPenalty,
        int passes,
        boolean converged
) {

    public OptimizationResult {
        entries = List.copyOf(entries);
    }
}
