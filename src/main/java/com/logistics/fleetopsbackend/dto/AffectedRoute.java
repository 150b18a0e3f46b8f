package com.logistics.fleetopsbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO grouping the outstanding stops of an unavailable driver on one route/vehicle.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AffectedRoute {
    private String routeId;
    private String vehicleId;
    private String vehiclePlate;
    private List<AffectedStop> stops = new ArrayList<>();
    private int totalStops;
    private int pendingStops;
    private int inProgressStops;

    public AffectedRoute(String routeId, String vehicleId, String vehiclePlate) {
        this.routeId = routeId;
        this.vehicleId = vehicleId;
        this.vehiclePlate = vehiclePlate;
    }
}
