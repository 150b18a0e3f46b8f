package com.logistics.fleetopsbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Regenerated route sheets for the drivers who received work in one execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReassignmentOutput {
    private String reassignmentHistoryId;
    private LocalDateTime generatedAt;
    private String generatedBy;
    private String absentDriverId;
    private String absentDriverName;
    private String reason;
    private List<DriverRouteOutput> driverRoutes;
    private Summary summary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DriverRouteOutput {
        private String driverId;
        private String driverName;
        private String vehicleId;
        private String vehiclePlate;
        private List<StopLine> stops;
        private int totalStops;
        private int pendingStops;
        private int completedStops;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StopLine {
        private int sequence;
        private String orderId;
        private String address;
        private LocalDateTime timeWindowStart;
        private LocalDateTime timeWindowEnd;
        private LocalDateTime estimatedArrival;
        private String status;
        private String notes;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int totalStops;
        private int totalRoutes;
        private int totalReplacementDrivers;
    }
}
