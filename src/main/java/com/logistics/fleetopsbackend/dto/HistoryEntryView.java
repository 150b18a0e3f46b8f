package com.logistics.fleetopsbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * History entry denormalized for display.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryEntryView {
    private String id;
    private String jobId;
    private String absentDriverId;
    private String absentDriverName;
    private List<ReplacementDriverSummary> replacementDrivers;
    private List<String> routeIds;
    private List<String> vehicleIds;
    private int totalStops;
    private String reason;
    private LocalDateTime createdAt;
    private String createdBy;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReplacementDriverSummary {
        private String id;
        private String name;
        private String routeId;
        private int stopsAssigned;
    }
}
