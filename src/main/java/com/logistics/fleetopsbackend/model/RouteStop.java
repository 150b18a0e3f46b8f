package com.logistics.fleetopsbackend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * One stop of a planned route. Owned by exactly one driver at a time;
 * reassignment changes {@code driverId} only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "route_stops")
@CompoundIndexes({
    @CompoundIndex(name = "company_driver_status_idx", def = "{'companyId': 1, 'driverId': 1, 'status': 1}"),
    @CompoundIndex(name = "company_job_driver_idx", def = "{'companyId': 1, 'jobId': 1, 'driverId': 1}"),
    @CompoundIndex(name = "route_vehicle_idx", def = "{'routeId': 1, 'vehicleId': 1}")
})
public class RouteStop {

    @Id
    private String id;

    private String companyId;
    private String jobId;
    private String routeId;
    private String vehicleId;
    private String driverId;
    private String orderId;

    private int sequence;
    private String address;
    private double latitude;
    private double longitude;

    private LocalDateTime timeWindowStart;
    private LocalDateTime timeWindowEnd;
    private LocalDateTime estimatedArrival;

    private StopStatus status;
    private String notes;
    private LocalDateTime updatedAt;

    // Execution that last moved this stop, compensation only touches its own moves
    private String reassignmentId;

    public boolean hasTimeWindow() {
        return timeWindowStart != null && timeWindowEnd != null;
    }

    /**
     * Stop already failing its promise: estimated arrival after the window end.
     */
    public boolean isWindowCompromised() {
        return hasTimeWindow() && estimatedArrival != null && estimatedArrival.isAfter(timeWindowEnd);
    }

    public RoutePoint toRoutePoint() {
        return new RoutePoint(latitude, longitude, sequence);
    }
}
