package com.logistics.fleetopsbackend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Quantified before/after comparison of a candidate driver absorbing an
 * unavailable driver's outstanding stops.
 *
 * <p>Distances are in meters, durations in seconds, everything else in percent
 * (0-100, rounded) unless stated otherwise.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactReport {

    private String replacementDriverId;
    private String replacementDriverName;

    private int stopsCount;

    private DistanceImpact additionalDistance;
    private TimeImpact additionalTime;
    private WindowImpact compromisedWindows;
    private CapacityImpact capacityUtilization;
    private SkillsMatch skillsMatch;
    private AvailabilityStatus availabilityStatus;

    @JsonProperty("isValid")
    private boolean valid;

    @Builder.Default
    private List<ReassignmentIssue> errors = new ArrayList<>();

    @Builder.Default
    private List<ReassignmentIssue> warnings = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DistanceImpact {
        private long absolute;
        private long percentage;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimeImpact {
        private long absolute;
        private long percentage;
        private String formatted;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WindowImpact {
        private int count;
        private long percentage;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CapacityImpact {
        private long current;
        private long projected;
        private long available;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkillsMatch {
        private long percentage;
        private List<String> missing = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AvailabilityStatus {
        @JsonProperty("isAvailable")
        private boolean available;
        private int currentStops;
        private int maxCapacity;
        private boolean canAbsorbStops;
    }
}
