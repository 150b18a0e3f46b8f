package com.logistics.fleetopsbackend.dto;

import com.logistics.fleetopsbackend.reassignment.ReassignmentStrategy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO binding one candidate driver to the impact of absorbing all affected work.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReassignmentOption {
    private String optionId;
    private CandidateDriver replacementDriver;
    private ImpactReport impact;
    private ReassignmentStrategy strategy;
    private List<String> routeIds;
}
