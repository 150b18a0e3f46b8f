package com.logistics.fleetopsbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for the tenant's reassignment dashboard counters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReassignmentStatusSummary {
    private long absentDriverCount;
    private long recentReassignmentCount;
}
