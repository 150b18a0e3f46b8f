package com.logistics.fleetopsbackend.dto;

import com.logistics.fleetopsbackend.reassignment.PriorityTier;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for a replacement driver offered for an unavailable driver's work.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateDriver {
    private String id;
    private String name;
    private String fleetId;
    private String fleetName;
    private PriorityTier priority;
}
