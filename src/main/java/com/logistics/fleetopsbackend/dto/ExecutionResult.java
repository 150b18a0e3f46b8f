package com.logistics.fleetopsbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an execution. On failure the counts are zero and {@code errors}
 * lists every cause, revert failures included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResult {
    private boolean success;
    private int reassignedStops;
    private int reassignedRoutes;
    private String reassignmentHistoryId;

    @Builder.Default
    private List<ReassignmentIssue> errors = new ArrayList<>();

    @Builder.Default
    private List<ReassignmentIssue> warnings = new ArrayList<>();

    private boolean manualVerificationRequired;

    public static ExecutionResult failure(List<ReassignmentIssue> errors, List<ReassignmentIssue> warnings) {
        return ExecutionResult.builder()
                .success(false)
                .errors(new ArrayList<>(errors))
                .warnings(new ArrayList<>(warnings))
                .build();
    }

    public boolean hasErrorOfType(IssueType type) {
        return errors.stream().anyMatch(e -> e.getType() == type);
    }
}
