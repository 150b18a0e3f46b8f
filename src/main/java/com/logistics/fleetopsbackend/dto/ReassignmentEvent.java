package com.logistics.fleetopsbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for reassignment events.
 * Sent to monitoring views after an execution commits.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReassignmentEvent {
    private String companyId;
    private String historyId;
    private String absentDriverId;
    private List<String> replacementDriverIds;
    private List<String> routeIds;
    private int reassignedStops;
    private LocalDateTime executedAt;
}
